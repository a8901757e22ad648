package com.polishfootball.network.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * In-memory cache store backed by Caffeine with per-entry absolute expiration.
 * <p>
 * Registry updates run inside Caffeine's per-key compute, so for any one key the
 * registry and the cache contents change together. Entries evicted for expiry or
 * size are unregistered by the eviction listener.
 */
public class LocalCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalCacheStore.class);

    private final Cache<String, CacheEntry> cache;
    private final KeyRegistry keyRegistry = new KeyRegistry();
    private final ObjectMapper objectMapper;
    private final Duration defaultTtl;
    private final Ticker ticker;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public LocalCacheStore(ObjectMapper objectMapper, Duration defaultTtl, long maximumSize) {
        this(objectMapper, defaultTtl, maximumSize, Ticker.systemTicker(), ForkJoinPool.commonPool());
    }

    LocalCacheStore(ObjectMapper objectMapper, Duration defaultTtl, long maximumSize,
                    Ticker ticker, Executor executor) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.defaultTtl = requireTtl(defaultTtl);
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .executor(executor)
                .evictionListener(this::onEviction)
                .build();
    }

    @Override
    public <T> Optional<T> get(String key, CacheValueType<T> type) {
        requireKey(key);
        Objects.requireNonNull(type, "type");

        try {
            CacheEntry entry = cache.policy().getIfPresentQuietly(key);

            if (entry == null || entry.isExpiredAt(ticker.read())) {
                misses.incrementAndGet();
                logger.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }

            if (entry.serialized() == type.isPrimitive()) {
                misses.incrementAndGet();
                logger.warn("Cache entry {} was stored with a different value type than {}", key, type);
                return Optional.empty();
            }

            T value = entry.serialized()
                    ? type.decode((String) entry.value(), objectMapper)
                    : type.cast(entry.value());

            hits.incrementAndGet();
            logger.debug("Cache hit for key: {}", key);
            return Optional.of(value);

        } catch (Exception e) {
            errors.incrementAndGet();
            logger.error("Error reading cache entry for key: {}", key, e);
            return Optional.empty();
        }
    }

    @Override
    public <T> void set(String key, T value, CacheValueType<T> type) {
        set(key, value, type, defaultTtl);
    }

    @Override
    public <T> void set(String key, T value, CacheValueType<T> type, Duration ttl) {
        requireKey(key);
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(type, "type");
        requireTtl(ttl);

        try {
            Object stored = type.isPrimitive() ? value : type.encode(value, objectMapper);
            long now = ticker.read();
            CacheEntry entry = new CacheEntry(stored, !type.isPrimitive(), now, saturatedAdd(now, ttl.toNanos()));

            cache.asMap().compute(key, (k, previous) -> {
                keyRegistry.register(k);
                return entry;
            });

            logger.debug("Value cached for key: {} with expiration: {}", key, ttl);

        } catch (Exception e) {
            errors.incrementAndGet();
            logger.error("Error setting value in cache for key: {}", key, e);
            throw new CacheOperationException("Failed to cache value for key " + key, e);
        }
    }

    @Override
    public void remove(String key) {
        requireKey(key);

        try {
            cache.asMap().compute(key, (k, previous) -> {
                keyRegistry.unregister(k);
                return null;
            });
            logger.debug("Value removed from cache for key: {}", key);

        } catch (Exception e) {
            errors.incrementAndGet();
            logger.error("Error removing value from cache for key: {}", key, e);
            throw new CacheOperationException("Failed to remove cache entry " + key, e);
        }
    }

    @Override
    public int removeByPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Cache key pattern must not be blank");
        }
        Pattern regex = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);

        try {
            cache.cleanUp();
            List<String> matching = keyRegistry.snapshot().stream()
                    .filter(key -> regex.matcher(key).find())
                    .toList();

            for (String key : matching) {
                remove(key);
            }

            logger.info("Removed {} cache entries matching pattern: {}", matching.size(), pattern);
            return matching.size();

        } catch (CacheOperationException e) {
            throw e;
        } catch (Exception e) {
            errors.incrementAndGet();
            logger.error("Error removing values from cache by pattern: {}", pattern, e);
            throw new CacheOperationException("Failed to remove cache entries matching " + pattern, e);
        }
    }

    @Override
    public boolean exists(String key) {
        requireKey(key);

        try {
            CacheEntry entry = cache.policy().getIfPresentQuietly(key);
            boolean exists = entry != null && !entry.isExpiredAt(ticker.read());
            logger.debug("Cache key existence check for {}: {}", key, exists);
            return exists;
        } catch (Exception e) {
            errors.incrementAndGet();
            logger.error("Error checking cache key existence: {}", key, e);
            return false;
        }
    }

    @Override
    public CacheStats stats() {
        cache.cleanUp();
        return new CacheStats(hits.get(), misses.get(), errors.get(), evictions.get(), keyRegistry.size());
    }

    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
        keyRegistry.clear();
        logger.info("Local cache store closed");
    }

    boolean isRegistered(String key) {
        return keyRegistry.contains(key);
    }

    void cleanUp() {
        cache.cleanUp();
    }

    private void onEviction(String key, CacheEntry entry, RemovalCause cause) {
        if (key == null) {
            return;
        }
        keyRegistry.unregister(key);
        evictions.incrementAndGet();
        logger.debug("Cache entry evicted: {}, Reason: {}", key, cause);
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key must not be blank");
        }
    }

    private static Duration requireTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Cache ttl must not be negative: " + ttl);
        }
        return ttl;
    }

    private static long saturatedAdd(long now, long ttlNanos) {
        long result = now + ttlNanos;
        return ((now ^ result) & (ttlNanos ^ result)) < 0 ? Long.MAX_VALUE : result;
    }

    private record CacheEntry(Object value, boolean serialized, long createdAtNanos, long expiresAtNanos) {

        boolean isExpiredAt(long nanos) {
            return nanos >= expiresAtNanos;
        }
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return Math.max(0, entry.expiresAtNanos() - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
