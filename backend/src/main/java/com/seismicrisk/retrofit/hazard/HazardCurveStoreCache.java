package com.seismicrisk.retrofit.hazard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Spring Cache backed storage of published hazard curve stores.
 *
 * CACHING STRATEGY:
 * - One entry per cache key, holding the complete immutable store
 * - Entries are written only by the reuse controller, under its per-key lock
 * - Entries are never expired by time; they are evicted on explicit invalidation
 *   or when the integrity job finds them inconsistent with the run ledger
 *
 * Calls go through the {@link CacheManager} rather than cache annotations because the
 * controller needs put and evict to happen inside its own critical section.
 */
@Service
@Slf4j
public class HazardCurveStoreCache {

    private final Cache cache;

    public HazardCurveStoreCache(CacheManager cacheManager, HazardCacheProperties properties) {
        Cache resolved = cacheManager.getCache(properties.getCacheName());
        if (resolved == null) {
            throw new IllegalStateException("Cache not configured: " + properties.getCacheName());
        }
        this.cache = resolved;
    }

    public Optional<HazardCurveStore> get(CacheKey key) {
        return Optional.ofNullable(cache.get(key.value(), HazardCurveStore.class));
    }

    public void put(CacheKey key, HazardCurveStore store) {
        log.debug("Caching hazard store {}", store);
        cache.put(key.value(), store);
    }

    public void evict(CacheKey key) {
        log.debug("Evicting hazard store {}", key.shortForm());
        cache.evict(key.value());
    }

    public void clear() {
        log.info("Evicting all hazard stores");
        cache.clear();
    }
}
