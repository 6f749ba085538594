package com.marketpush.source;

import com.marketpush.domain.model.RecipientContent;

/**
 * Upstream that knows each recipient's authoritative settings and the content
 * currently available to them.
 */
public interface ContentSource {

    /**
     * @throws com.marketpush.exception.AuthExpiredException when the credential was rejected
     * @throws com.marketpush.exception.UpstreamUnavailableException on network or server failure
     * @throws com.marketpush.exception.MalformedContentException when the response cannot be read
     */
    RecipientContent fetch(String recipientId, String credential);

    /** Round-trips a fetch and reports whether upstream answered. Never throws. */
    boolean healthCheck(String recipientId, String credential);
}
