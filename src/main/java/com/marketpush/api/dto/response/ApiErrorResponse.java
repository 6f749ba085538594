package com.marketpush.api.dto.response;

import com.marketpush.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;

/**
 * Envelope for failed operator API responses. {@code error.retryable} mirrors
 * {@link ErrorCode#isRetryable()}: upstream and Telegram outages are worth retrying,
 * bad input is not.
 */
public record ApiErrorResponse(boolean success, Failure error) {

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(
                false,
                new Failure(
                        errorCode.getCode(),
                        message,
                        errorCode.isRetryable(),
                        details == null || details.isEmpty() ? null : details,
                        path,
                        Instant.now()));
    }

    public record Failure(
            String code,
            String message,
            boolean retryable,
            Map<String, Object> details,
            String path,
            Instant timestamp) {}
}
