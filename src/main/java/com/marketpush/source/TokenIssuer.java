package com.marketpush.source;

/** Exchanges a recipient id for a fresh upstream access token. */
public interface TokenIssuer {

    String issue(String recipientId);
}
