package com.marketpush.exception;

import java.util.Map;

/** The messaging gateway did not accept a message. The item stays eligible for the next cycle. */
public class GatewaySendFailedException extends BaseException {

    public GatewaySendFailedException(String channelId, String message) {
        super(ErrorCode.GATEWAY_SEND_FAILED, message, Map.of("channelId", channelId));
    }

    public GatewaySendFailedException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_SEND_FAILED, message, cause);
    }
}
