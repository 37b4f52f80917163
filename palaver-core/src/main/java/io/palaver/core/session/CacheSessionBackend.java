package io.palaver.core.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed documents with a per-write time to live. Suited to ephemeral sessions such as
 * USSD dials, which simply restart from empty state once they expire.
 */
public final class CacheSessionBackend implements SessionBackend {
    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private final Cache<String, CachedDocument> cache;

    public CacheSessionBackend(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CacheSessionBackend(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(Math.max(1, maximumSize))
            .expireAfter(new DocumentExpiry())
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
    }

    @Override
    public Optional<String> read(String sessionId) {
        return Optional.ofNullable(cache.getIfPresent(sessionId)).map(CachedDocument::document);
    }

    @Override
    public void write(String sessionId, String document, Duration ttl) {
        cache.put(sessionId, new CachedDocument(document, ttl));
    }

    @Override
    public void remove(String sessionId) {
        cache.invalidate(sessionId);
    }

    @Override
    public boolean exists(String sessionId) {
        return cache.getIfPresent(sessionId) != null;
    }

    private record CachedDocument(String document, Duration ttl) {
        long ttlNanos() {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                return NO_EXPIRY;
            }
            return ttl.toNanos();
        }
    }

    private static final class DocumentExpiry implements Expiry<String, CachedDocument> {
        @Override
        public long expireAfterCreate(String key, CachedDocument value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedDocument value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedDocument value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
