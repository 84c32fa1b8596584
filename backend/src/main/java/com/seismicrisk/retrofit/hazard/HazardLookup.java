package com.seismicrisk.retrofit.hazard;

/**
 * Hazard store handed to an analysis, with how it was obtained.
 *
 * @param inconsistencyRecovered true when a stale or corrupt cache entry was discarded
 *                               before this store was computed
 */
public record HazardLookup(
        CacheKey cacheKey,
        HazardCurveStore store,
        HazardSource source,
        boolean inconsistencyRecovered
) {}
