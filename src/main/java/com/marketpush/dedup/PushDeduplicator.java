package com.marketpush.dedup;

import com.marketpush.config.PushProperties;
import com.marketpush.domain.enums.ContentCategory;
import com.marketpush.domain.model.ContentItem;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Suppresses items already delivered to a scope within the retention window.
 *
 * <p>A scope is one user chat or one group chat ({@code user:123}, {@code group:-100456}).
 * Scopes never share records, so whether a group receives an item never depends on
 * whether its owner already saw it.
 *
 * <p>Records are written only by {@link #markDelivered}, which the dispatcher calls
 * after the gateway confirmed the send. Expiry is checked lazily on lookup; an
 * expired record is evicted on the spot instead of by a background sweep.
 *
 * <p>Ledger failures fail open: on lookup the item is treated as new (a possible
 * duplicate beats a lost alert), on write the error is logged and the send still counts.
 */
@Service
public class PushDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(PushDeduplicator.class);

    private final DeliveryLedger deliveryLedger;
    private final PushProperties pushProperties;

    public PushDeduplicator(DeliveryLedger deliveryLedger, PushProperties pushProperties) {
        this.deliveryLedger = deliveryLedger;
        this.pushProperties = pushProperties;
    }

    public List<ContentItem> filterDuplicates(String scopeId, List<ContentItem> items, ContentCategory category) {
        return filterDuplicates(scopeId, items, category, Instant.now());
    }

    /**
     * Testable version: evaluates expiry against the given time.
     *
     * @return items with no unexpired record for the scope, in input order, with
     *     repeats inside {@code items} collapsed to the first occurrence
     */
    public List<ContentItem> filterDuplicates(
            String scopeId, List<ContentItem> items, ContentCategory category, Instant now) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }

        Duration retention = retention();
        List<ContentItem> fresh = new ArrayList<>(items.size());
        Set<String> seenInBatch = new HashSet<>();

        for (ContentItem item : items) {
            if (!seenInBatch.add(item.getFingerprint())) {
                continue;
            }
            DedupKey key = new DedupKey(scopeId, category, item.getFingerprint());
            if (!isDelivered(key, now, retention)) {
                fresh.add(item);
            }
        }

        if (fresh.size() < items.size()) {
            log.debug(
                    "Dedup {} {}: {} of {} items already delivered",
                    scopeId,
                    category.getKey(),
                    items.size() - fresh.size(),
                    items.size());
        }
        return fresh;
    }

    public void markDelivered(String scopeId, List<ContentItem> items, ContentCategory category) {
        markDelivered(scopeId, items, category, Instant.now());
    }

    /** Testable version: records delivery at the given time. */
    public void markDelivered(String scopeId, List<ContentItem> items, ContentCategory category, Instant now) {
        if (items == null || items.isEmpty()) {
            return;
        }
        Duration retention = retention();
        for (ContentItem item : items) {
            DedupKey key = new DedupKey(scopeId, category, item.getFingerprint());
            try {
                deliveryLedger.record(key, now, retention);
            } catch (RuntimeException e) {
                log.warn("Failed to record delivery {}: {}", key.asString(), e.getMessage());
            }
        }
        log.debug("Marked {} {} items delivered for {}", items.size(), category.getKey(), scopeId);
    }

    /** Operator reset of a scope. A null category clears every category. */
    public int clearScope(String scopeId, ContentCategory category) {
        int cleared = deliveryLedger.clear(scopeId, category);
        log.info(
                "Cleared {} dedup records for {} ({})",
                cleared,
                scopeId,
                category != null ? category.getKey() : "all categories");
        return cleared;
    }

    public boolean isDelivered(String scopeId, ContentCategory category, String fingerprint, Instant now) {
        return isDelivered(new DedupKey(scopeId, category, fingerprint), now, retention());
    }

    private boolean isDelivered(DedupKey key, Instant now, Duration retention) {
        Optional<Instant> deliveredAt;
        try {
            deliveredAt = deliveryLedger.deliveredAt(key);
        } catch (RuntimeException e) {
            log.warn("Dedup lookup failed for {}, treating as new: {}", key.asString(), e.getMessage());
            return false;
        }
        if (deliveredAt.isEmpty()) {
            return false;
        }
        if (!deliveredAt.get().plus(retention).isAfter(now)) {
            evictQuietly(key);
            return false;
        }
        return true;
    }

    private void evictQuietly(DedupKey key) {
        try {
            deliveryLedger.evict(key);
        } catch (RuntimeException e) {
            log.debug("Could not evict expired dedup record {}: {}", key.asString(), e.getMessage());
        }
    }

    private Duration retention() {
        return pushProperties.getDedup().getRetention();
    }
}
