package com.marketpush.api.dto.response;

import java.time.Instant;

/** Envelope for successful operator API responses: {@code {success, data, timestamp}}. */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
