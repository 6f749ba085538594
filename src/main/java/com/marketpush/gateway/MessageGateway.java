package com.marketpush.gateway;

import com.marketpush.domain.model.RenderedMessage;

/** Outbound chat transport. */
public interface MessageGateway {

    /**
     * Sends one message and returns only once the transport accepted it.
     *
     * @throws com.marketpush.exception.GatewaySendFailedException when the message was not accepted
     */
    void send(String channelId, RenderedMessage message);
}
