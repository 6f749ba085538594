package com.marketpush.dedup;

import com.marketpush.domain.enums.ContentCategory;

/** Identity of a delivery record: who received which item of which category. */
public record DedupKey(String scopeId, ContentCategory category, String fingerprint) {

    /** Flat string form, also used as the Redis key suffix. */
    public String asString() {
        return scopeId + ":" + category.getKey() + ":" + fingerprint;
    }
}
