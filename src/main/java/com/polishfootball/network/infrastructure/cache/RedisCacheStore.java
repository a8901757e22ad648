package com.polishfootball.network.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Redis-backed cache store for deployments running more than one instance.
 * <p>
 * Values live under {@code keyPrefix + key} with a native Redis TTL. The key registry is a
 * Redis set updated in the same script as the value, so pattern eviction sees keys written by
 * every instance. Redis gives no callback when a TTL fires; registry members whose value has
 * expired are pruned during pattern scans with an atomic check-and-remove script.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);

    private static final String PRIMITIVE_TAG = "p|";
    private static final String JSON_TAG = "j|";

    // Each script takes KEYS[1] registry set, KEYS[2] value key, ARGV[1] registry member
    private static final RedisScript<Long> SET_AND_REGISTER = new DefaultRedisScript<>("""
            redis.call('SET', KEYS[2], ARGV[2], 'PX', ARGV[3])
            redis.call('SADD', KEYS[1], ARGV[1])
            return 1
            """, Long.class);

    private static final RedisScript<Long> REMOVE_AND_UNREGISTER = new DefaultRedisScript<>("""
            local removed = redis.call('DEL', KEYS[2])
            redis.call('SREM', KEYS[1], ARGV[1])
            return removed
            """, Long.class);

    private static final RedisScript<Long> PRUNE_IF_EXPIRED = new DefaultRedisScript<>("""
            if redis.call('EXISTS', KEYS[2]) == 0 then
                return redis.call('SREM', KEYS[1], ARGV[1])
            end
            return 0
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final String registryKey;
    private final Duration defaultTtl;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public RedisCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                           String keyPrefix, Duration defaultTtl) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.registryKey = this.keyPrefix + "registry";
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
    }

    @Override
    public <T> Optional<T> get(String key, CacheValueType<T> type) {
        requireKey(key);

        try {
            String stored = redisTemplate.opsForValue().get(redisKey(key));

            if (stored == null) {
                misses.incrementAndGet();
                logger.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }

            String expectedTag = type.isPrimitive() ? PRIMITIVE_TAG : JSON_TAG;
            if (!stored.startsWith(expectedTag)) {
                misses.incrementAndGet();
                logger.warn("Cache entry {} was stored with a different value type than {}", key, type);
                return Optional.empty();
            }

            T value = type.decode(stored.substring(expectedTag.length()), objectMapper);
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
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Cache ttl must not be negative: " + ttl);
        }

        try {
            // Redis rejects a zero expiry; an entry that expires immediately is simply absent
            if (ttl.isZero()) {
                remove(key);
                return;
            }

            String tag = type.isPrimitive() ? PRIMITIVE_TAG : JSON_TAG;
            String payload = tag + type.encode(value, objectMapper);
            long ttlMillis = Math.max(1, ttl.toMillis());
            redisTemplate.execute(SET_AND_REGISTER, registryKeys(key), key, payload, Long.toString(ttlMillis));

            logger.debug("Value cached for key: {} with expiration: {}", key, ttl);

        } catch (CacheOperationException e) {
            throw e;
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
            redisTemplate.execute(REMOVE_AND_UNREGISTER, registryKeys(key), key);
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
            Set<String> members = redisTemplate.opsForSet().members(registryKey);
            if (members == null || members.isEmpty()) {
                return 0;
            }

            int removed = 0;
            for (String key : members) {
                if (regex.matcher(key).find()) {
                    remove(key);
                    removed++;
                } else if (pruneIfExpired(key)) {
                    evictions.incrementAndGet();
                }
            }

            logger.info("Removed {} cache entries matching pattern: {}", removed, pattern);
            return removed;

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
            boolean exists = Boolean.TRUE.equals(redisTemplate.hasKey(redisKey(key)));
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
        try {
            Long registered = redisTemplate.opsForSet().size(registryKey);
            return new CacheStats(hits.get(), misses.get(), errors.get(), evictions.get(),
                    registered != null ? registered : 0);
        } catch (Exception e) {
            logger.warn("Failed to get cache stats: {}", e.getMessage());
            return new CacheStats(hits.get(), misses.get(), errors.get(), evictions.get(), 0);
        }
    }

    /**
     * Drops a registry member whose value is gone. Value writes, removals and this check each run as a
     * single script, so a {@code set} from another instance is never left unregistered.
     */
    private boolean pruneIfExpired(String key) {
        Long removed = redisTemplate.execute(PRUNE_IF_EXPIRED, registryKeys(key), key);
        return removed != null && removed > 0;
    }

    private List<String> registryKeys(String key) {
        return List.of(registryKey, redisKey(key));
    }

    private String redisKey(String key) {
        return keyPrefix + key;
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache key must not be blank");
        }
    }
}
