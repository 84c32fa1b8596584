package com.seismicrisk.retrofit.domain.error;

import com.seismicrisk.retrofit.domain.model.FailureKind;
import lombok.Getter;

/**
 * The run ledger and the curve cache disagree about a key. Used to trigger
 * recomputation; never surfaces as a result.
 */
@Getter
public class CacheInconsistencyException extends RiskComputationException {

    private final String cacheKey;

    public CacheInconsistencyException(String cacheKey, String message) {
        super(FailureKind.CACHE_INCONSISTENCY, "Cache entry " + cacheKey + ": " + message);
        this.cacheKey = cacheKey;
    }
}
