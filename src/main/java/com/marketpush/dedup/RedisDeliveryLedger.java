package com.marketpush.dedup;

import com.marketpush.config.DedupStoreConfig;
import com.marketpush.domain.enums.ContentCategory;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed ledger for deployments running more than one instance.
 *
 * <p>Key format: push:dedup:{scopeId}:{category}:{fingerprint}
 * Value: delivery time in epoch millis. Keys carry a TTL equal to the retention
 * window so Redis reclaims them without a sweep.
 */
public class RedisDeliveryLedger implements DeliveryLedger {

    private static final Logger log = LoggerFactory.getLogger(RedisDeliveryLedger.class);

    private final StringRedisTemplate redisTemplate;

    public RedisDeliveryLedger(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<Instant> deliveredAt(DedupKey key) {
        String value = redisTemplate.opsForValue().get(keyFor(key));
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
        } catch (NumberFormatException e) {
            log.warn("Corrupt dedup record {}, ignoring: {}", keyFor(key), value);
            return Optional.empty();
        }
    }

    @Override
    public void record(DedupKey key, Instant deliveredAt, Duration retention) {
        redisTemplate.opsForValue().set(keyFor(key), Long.toString(deliveredAt.toEpochMilli()), retention);
    }

    @Override
    public void evict(DedupKey key) {
        redisTemplate.delete(keyFor(key));
    }

    @Override
    public int clear(String scopeId, ContentCategory category) {
        String pattern = DedupStoreConfig.KEY_PREFIX_DEDUP + scopeId + ":"
                + (category != null ? category.getKey() + ":" : "") + "*";
        Set<String> keys = redisTemplate.keys(pattern);
        if (keys == null || keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted != null ? deleted.intValue() : 0;
    }

    @Override
    public int size() {
        Set<String> keys = redisTemplate.keys(DedupStoreConfig.KEY_PREFIX_DEDUP + "*");
        return keys != null ? keys.size() : 0;
    }

    private String keyFor(DedupKey key) {
        return DedupStoreConfig.KEY_PREFIX_DEDUP + key.asString();
    }
}
