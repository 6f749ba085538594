package com.marketpush.source;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.marketpush.config.PushProperties;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-recipient token cache in front of the {@link TokenIssuer}.
 *
 * <p>Refreshes for one recipient are single-flight: a thread that finds another
 * refresh in progress waits for it and reuses the result instead of issuing again.
 * Entries carry their own expiry so lookups can be evaluated against a supplied time;
 * the cache's write expiry only bounds memory.
 */
@Component
public class CachingCredentialProvider implements CredentialProvider {

    private static final Logger log = LoggerFactory.getLogger(CachingCredentialProvider.class);

    private static final long MAX_CACHED_TOKENS = 100_000;

    private final TokenIssuer tokenIssuer;
    private final PushProperties pushProperties;

    private final Cache<String, CachedToken> tokens;
    private final Map<String, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    public CachingCredentialProvider(TokenIssuer tokenIssuer, PushProperties pushProperties) {
        this.tokenIssuer = tokenIssuer;
        this.pushProperties = pushProperties;
        this.tokens = Caffeine.newBuilder()
                .expireAfterWrite(pushProperties.getUpstream().getTokenTtl())
                .maximumSize(MAX_CACHED_TOKENS)
                .build();
    }

    @Override
    public String getToken(String recipientId) {
        return getToken(recipientId, Instant.now());
    }

    /** Testable version: evaluates token expiry against the given time. */
    public String getToken(String recipientId, Instant now) {
        CachedToken cached = tokens.getIfPresent(recipientId);
        if (cached != null && cached.expiresAt().isAfter(now)) {
            return cached.token();
        }
        ReentrantLock lock = lockFor(recipientId);
        lock.lock();
        try {
            cached = tokens.getIfPresent(recipientId);
            if (cached != null && cached.expiresAt().isAfter(now)) {
                return cached.token();
            }
            return issueAndCache(recipientId, now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String refreshToken(String recipientId) {
        CachedToken stale = tokens.getIfPresent(recipientId);
        ReentrantLock lock = lockFor(recipientId);
        if (!lock.tryLock()) {
            // Another thread is already refreshing; wait and reuse its token
            lock.lock();
            try {
                CachedToken current = tokens.getIfPresent(recipientId);
                if (current != null && current != stale) {
                    return current.token();
                }
                return issueAndCache(recipientId, Instant.now());
            } finally {
                lock.unlock();
            }
        }
        try {
            log.info("Refreshing upstream credential for {}", recipientId);
            return issueAndCache(recipientId, Instant.now());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate(String recipientId) {
        tokens.invalidate(recipientId);
    }

    private String issueAndCache(String recipientId, Instant now) {
        String token = tokenIssuer.issue(recipientId);
        tokens.put(recipientId, new CachedToken(token, now.plus(pushProperties.getUpstream().getTokenTtl())));
        return token;
    }

    private ReentrantLock lockFor(String recipientId) {
        return refreshLocks.computeIfAbsent(recipientId, id -> new ReentrantLock());
    }

    private record CachedToken(String token, Instant expiresAt) {}
}
