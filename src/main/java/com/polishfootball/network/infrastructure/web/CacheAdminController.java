package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.infrastructure.cache.CacheStats;
import com.polishfootball.network.infrastructure.cache.CacheStore;
import com.polishfootball.network.infrastructure.web.dto.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual cache busting and cache statistics.
 */
@RestController
@RequestMapping("/api/admin/cache")
public class CacheAdminController {

    private static final Logger logger = LoggerFactory.getLogger(CacheAdminController.class);

    private final CacheStore cacheStore;

    public CacheAdminController(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse<Map<String, Integer>>> evict(@RequestParam String pattern) {
        logger.info("Manual cache eviction requested for pattern: {}", pattern);
        int removed = cacheStore.removeByPattern(pattern);
        return ResponseEntity.ok(ApiResponse.ok("Removed " + removed + " cache entries", Map.of("removed", removed)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<CacheStats>> stats() {
        CacheStats stats = cacheStore.stats();
        logger.info("Cache stats requested: {}", stats.summary());
        return ResponseEntity.ok(ApiResponse.ok(stats));
    }
}
