package com.marketpush.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error taxonomy of the push engine. {@code retryable} tells an operator whether the
 * same call can succeed later without changing anything.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    CONFLICT("CONFLICT", 409, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    AUTH_EXPIRED("AUTH_EXPIRED", 502, true),
    UPSTREAM_UNAVAILABLE("UPSTREAM_UNAVAILABLE", 502, true),
    MALFORMED_CONTENT("MALFORMED_CONTENT", 502, false),
    GATEWAY_SEND_FAILED("GATEWAY_SEND_FAILED", 502, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
