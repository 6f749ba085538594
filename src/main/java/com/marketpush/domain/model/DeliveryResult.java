package com.marketpush.domain.model;

import lombok.Value;

/**
 * Outcome of delivering to a single channel in one execution.
 *
 * <p>{@code dropped} counts items that could not be rendered; they are neither
 * sent nor marked delivered.
 */
@Value
public class DeliveryResult {

    String channelId;
    int sent;
    int failed;
    int dropped;

    public boolean isFullySuccessful() {
        return failed == 0;
    }

    public static DeliveryResult empty(String channelId) {
        return new DeliveryResult(channelId, 0, 0, 0);
    }
}
