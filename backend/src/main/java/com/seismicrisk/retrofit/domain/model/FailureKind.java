package com.seismicrisk.retrofit.domain.model;

/**
 * Reason an individual asset could not be analyzed.
 */
public enum FailureKind {
    INCOMPATIBLE_INTENSITY_MEASURE,
    DEGENERATE_CURVE,
    INVALID_ECONOMICS,
    MALFORMED_CURVE,
    MISSING_INPUT,
    CACHE_INCONSISTENCY,
    INTERNAL
}
