package com.polishfootball.network.application.query;

import com.polishfootball.network.infrastructure.cache.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Runs a {@link CachedQuery}: validate, derive key, read through the cache,
 * load on a miss, populate the cache and return.
 */
@Component
public class CachedQueryPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CachedQueryPipeline.class);

    private final CacheStore cacheStore;
    private final RequestValidator validator;

    public CachedQueryPipeline(CacheStore cacheStore, RequestValidator validator) {
        this.cacheStore = cacheStore;
        this.validator = validator;
    }

    public <Q, R> QueryResult<R> execute(CachedQuery<Q, R> query, Q request) {
        List<FieldError> errors = validator.validate(request);
        if (!errors.isEmpty()) {
            logger.warn("Validation failed for {} query: {}", query.name(), errors);
            return QueryResult.invalid(errors);
        }

        String cacheKey = null;
        try {
            cacheKey = query.cacheKey(request);

            Optional<R> cached = cacheStore.get(cacheKey, query.resultType());
            if (cached.isPresent()) {
                logger.debug("Returning cached {} result for key: {}", query.name(), cacheKey);
                return QueryResult.success(cached.get());
            }

            logger.debug("Cache miss for {} - loading from store", query.name());
            R result = query.load(request);

            if (Thread.currentThread().isInterrupted()) {
                logger.info("{} query cancelled before caching result for key: {}", query.name(), cacheKey);
                return QueryResult.cancelled("The " + query.name() + " request was cancelled.");
            }

            populate(cacheKey, result, query);
            return QueryResult.success(result);

        } catch (ResourceNotFoundException e) {
            logger.warn("{} query refers to a missing resource: {}", query.name(), e.getMessage());
            return QueryResult.notFound(e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error during {} query processing, request={}, key={}",
                    query.name(), request, cacheKey, e);
            return QueryResult.failure("An unexpected error occurred while retrieving " + query.name() + ".");
        }
    }

    private <Q, R> void populate(String cacheKey, R result, CachedQuery<Q, R> query) {
        try {
            cacheStore.set(cacheKey, result, query.resultType(), query.ttl());
        } catch (RuntimeException e) {
            logger.warn("Could not cache {} result for key {}: {}", query.name(), cacheKey, e.getMessage());
        }
    }
}
