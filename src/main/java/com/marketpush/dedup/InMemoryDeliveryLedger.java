package com.marketpush.dedup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.marketpush.domain.enums.ContentCategory;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-local ledger backed by a Caffeine cache.
 *
 * <p>Entries are dropped once {@code retention} has passed since they were written,
 * so fingerprints upstream stops offering do not pile up. The deduplicator still
 * checks expiry against the recorded delivery time on every lookup.
 */
public class InMemoryDeliveryLedger implements DeliveryLedger {

    private final Cache<DedupKey, Instant> records;

    public InMemoryDeliveryLedger(Duration retention) {
        this(retention, Ticker.systemTicker());
    }

    public InMemoryDeliveryLedger(Duration retention, Ticker ticker) {
        this.records = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<Instant> deliveredAt(DedupKey key) {
        return Optional.ofNullable(records.getIfPresent(key));
    }

    @Override
    public void record(DedupKey key, Instant deliveredAt, Duration retention) {
        records.put(key, deliveredAt);
    }

    @Override
    public void evict(DedupKey key) {
        records.invalidate(key);
    }

    @Override
    public int clear(String scopeId, ContentCategory category) {
        int before = size();
        records.asMap()
                .keySet()
                .removeIf(key -> key.scopeId().equals(scopeId) && (category == null || key.category() == category));
        return before - size();
    }

    @Override
    public int size() {
        records.cleanUp();
        return Math.toIntExact(records.estimatedSize());
    }
}
