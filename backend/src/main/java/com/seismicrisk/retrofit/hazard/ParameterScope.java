package com.seismicrisk.retrofit.hazard;

/**
 * Whether changing a job parameter invalidates previously computed hazard curves.
 */
public enum ParameterScope {
    /** Part of the cache key. */
    HAZARD,
    /** Affects only post-processing, export or risk. Never part of the cache key. */
    DOWNSTREAM
}
