package com.seismicrisk.retrofit.domain.model;

/**
 * Lifecycle of a hazard computation recorded in the run ledger.
 */
public enum HazardRunStatus {
    /**
     * Computation in progress. The store is not visible yet.
     */
    RUNNING,

    /**
     * Store published and reusable.
     */
    COMPLETE,

    /**
     * The hazard calculator failed.
     */
    FAILED,

    /**
     * Cancelled before publishing. Nothing was stored.
     */
    CANCELLED,

    /**
     * Store evicted explicitly or found missing/corrupt. The next run recomputes.
     */
    INVALIDATED
}
