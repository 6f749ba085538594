package com.marketpush.exception;

/**
 * Network failure, timeout or server-side error from upstream. Not retried
 * within the same cycle; the recipient is counted as failed and stays registered.
 */
public class UpstreamUnavailableException extends BaseException {

    public UpstreamUnavailableException(String message) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
