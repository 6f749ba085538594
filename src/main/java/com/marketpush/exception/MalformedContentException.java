package com.marketpush.exception;

/**
 * An upstream response or a single content item could not be interpreted.
 * Item-level occurrences drop the item; response-level occurrences fail the
 * recipient for this cycle.
 */
public class MalformedContentException extends BaseException {

    public MalformedContentException(String message) {
        super(ErrorCode.MALFORMED_CONTENT, message);
    }

    public MalformedContentException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_CONTENT, message, cause);
    }
}
