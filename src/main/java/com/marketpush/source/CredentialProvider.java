package com.marketpush.source;

/** Supplies the upstream credential for a recipient. */
public interface CredentialProvider {

    /** Returns a cached credential when one is still valid, otherwise obtains a new one. */
    String getToken(String recipientId);

    /** Always obtains a new credential, replacing whatever was cached. */
    String refreshToken(String recipientId);

    void invalidate(String recipientId);
}
