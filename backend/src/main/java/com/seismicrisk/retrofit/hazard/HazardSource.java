package com.seismicrisk.retrofit.hazard;

/**
 * Where the hazard curves of an analysis came from.
 */
public enum HazardSource {
    /** Served from a previously published store. */
    CACHE,
    /** Computed by this request. */
    COMPUTED,
    /** Waited on a computation started by a concurrent request for the same key. */
    COALESCED
}
