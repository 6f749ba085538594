package com.marketpush.config;

import com.marketpush.dedup.DeliveryLedger;
import com.marketpush.dedup.InMemoryDeliveryLedger;
import com.marketpush.dedup.RedisDeliveryLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Chooses where delivery records live.
 *
 * <p>{@code push.dedup.store=memory} (default) keeps them in the JVM. {@code redis}
 * shares them across instances. All keys are prefixed with "push:" because the
 * Redis server may be shared with other applications.
 *
 * <p>Key schema:
 * <pre>
 *   push:dedup:{scopeId}:{category}:{fingerprint} → delivered-at epoch millis (TTL = retention)
 * </pre>
 */
@Configuration
public class DedupStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(DedupStoreConfig.class);

    /** Prefix applied to every ledger key on a shared Redis server. */
    public static final String KEY_PREFIX = "push:";

    public static final String KEY_PREFIX_DEDUP = KEY_PREFIX + "dedup:";

    @Bean
    @ConditionalOnProperty(name = "push.dedup.store", havingValue = "memory", matchIfMissing = true)
    public DeliveryLedger inMemoryDeliveryLedger(PushProperties pushProperties) {
        log.info("Dedup records stored in memory");
        return new InMemoryDeliveryLedger(pushProperties.getDedup().getRetention());
    }

    @Bean
    @ConditionalOnProperty(name = "push.dedup.store", havingValue = "redis")
    public DeliveryLedger redisDeliveryLedger(StringRedisTemplate stringRedisTemplate) {
        log.info("Dedup records stored in Redis under {}", KEY_PREFIX_DEDUP);
        return new RedisDeliveryLedger(stringRedisTemplate);
    }
}
