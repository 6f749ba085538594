package com.marketpush.dedup;

import com.marketpush.domain.enums.ContentCategory;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage behind {@link PushDeduplicator}. Only the deduplicator talks to it.
 *
 * <p>Implementations may drop records on their own after {@code retention}, but
 * they are not required to: expiry is always re-checked by the deduplicator at
 * lookup time.
 */
public interface DeliveryLedger {

    Optional<Instant> deliveredAt(DedupKey key);

    void record(DedupKey key, Instant deliveredAt, Duration retention);

    void evict(DedupKey key);

    /** Removes every record of a scope, optionally restricted to one category. Returns the count removed. */
    int clear(String scopeId, ContentCategory category);

    int size();
}
