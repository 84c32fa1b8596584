package com.seismicrisk.retrofit.adapters;

import com.seismicrisk.retrofit.hazard.CacheKey;
import com.seismicrisk.retrofit.hazard.HazardCurveStore;
import com.seismicrisk.retrofit.hazard.JobConfiguration;

/**
 * Port to the probabilistic seismic hazard analysis that produces hazard curves.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Produce one curve per (site, intensity-measure type, realization) for every
 *    site and IMT in the configuration, on the configured intensity levels
 * 2. Give every realization a weight; weights sum to 1
 * 3. Depend only on the HAZARD-scoped parameters of the configuration
 * 4. Respond to thread interruption by throwing {@link InterruptedException}
 *
 * Implementations are called from the reuse controller's bounded executor, never
 * more than once at a time for the same key.
 */
public interface HazardCalculator {

    /**
     * Short name for logs and the run ledger.
     */
    String getName();

    /**
     * Compute the hazard curves for a job.
     *
     * @param cacheKey      key the resulting store will be published under
     * @param configuration job parameters
     * @return complete store for the key
     * @throws InterruptedException when the computation is cancelled
     */
    HazardCurveStore calculate(CacheKey cacheKey, JobConfiguration configuration) throws InterruptedException;
}
