package com.seismicrisk.retrofit.domain.model;

/**
 * The two vulnerability models compared by a benefit-cost analysis.
 */
public enum VulnerabilityVariant {
    /**
     * Structure as built.
     */
    ORIGINAL,

    /**
     * Structure after the proposed retrofit.
     */
    RETROFITTED
}
