package com.marketpush.domain.enums;

/**
 * Kind of push destination. Users and groups never share a dedup scope even
 * when the platform assigns them overlapping identifiers.
 */
public enum RecipientKind {
    USER("user"),
    GROUP("group");

    private final String scopePrefix;

    RecipientKind(String scopePrefix) {
        this.scopePrefix = scopePrefix;
    }

    public String scopeIdFor(String recipientId) {
        return scopePrefix + ":" + recipientId;
    }
}
