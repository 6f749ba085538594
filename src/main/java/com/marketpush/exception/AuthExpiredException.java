package com.marketpush.exception;

/**
 * Upstream rejected the credential (HTTP 401/403). Recoverable by refreshing
 * the credential once and retrying once, see
 * {@link com.marketpush.source.AuthenticatedCallExecutor}.
 */
public class AuthExpiredException extends BaseException {

    public AuthExpiredException(String message) {
        super(ErrorCode.AUTH_EXPIRED, message);
    }

    public AuthExpiredException(String message, Throwable cause) {
        super(ErrorCode.AUTH_EXPIRED, message, cause);
    }
}
