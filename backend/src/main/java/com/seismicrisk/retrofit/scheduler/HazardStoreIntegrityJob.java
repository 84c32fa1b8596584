package com.seismicrisk.retrofit.scheduler;

import com.seismicrisk.retrofit.domain.error.CacheInconsistencyException;
import com.seismicrisk.retrofit.domain.model.HazardRun;
import com.seismicrisk.retrofit.domain.model.HazardRunStatus;
import com.seismicrisk.retrofit.domain.repository.HazardRunRepository;
import com.seismicrisk.retrofit.hazard.CacheKey;
import com.seismicrisk.retrofit.hazard.HazardReuseController;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled check that every COMPLETE hazard run still has a matching store in cache.
 *
 * A run whose store was evicted or no longer matches its checksum is marked
 * INVALIDATED, so the next job with the same hazard parameters recomputes instead of
 * discovering the problem mid-analysis.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HazardStoreIntegrityJob {

    private final HazardRunRepository hazardRunRepository;
    private final HazardReuseController hazardReuseController;

    /**
     * Runs every hour by default.
     */
    @Scheduled(fixedDelayString = "${hazard.cache.integrity-check-interval-ms:3600000}",
               initialDelayString = "${hazard.cache.integrity-check-interval-ms:3600000}")
    public void verifyCompletedRuns() {
        var completed = hazardRunRepository.findByStatusOrderByStartedAtAsc(HazardRunStatus.COMPLETE);
        log.info("Verifying {} completed hazard runs", completed.size());

        int healthy = 0;
        int invalidated = 0;
        int errors = 0;

        for (HazardRun run : completed) {
            CacheKey key = CacheKey.of(run.getCacheKey());
            try {
                hazardReuseController.verify(key);
                healthy++;
            } catch (CacheInconsistencyException e) {
                log.warn("Hazard run {} is inconsistent with the cache: {}", key.shortForm(), e.getMessage());
                hazardReuseController.discard(key, e.getMessage());
                invalidated++;
            } catch (RuntimeException e) {
                log.error("Failed to verify hazard run {}: {}", key.shortForm(), e.getMessage());
                errors++;
            }
        }

        log.info("Integrity check complete: {} healthy, {} invalidated, {} errors", healthy, invalidated, errors);
    }
}
