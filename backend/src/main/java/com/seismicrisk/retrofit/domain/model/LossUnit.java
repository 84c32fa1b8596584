package com.seismicrisk.retrofit.domain.model;

/**
 * Unit of the loss axis of a loss-exceedance curve.
 */
public enum LossUnit {
    /**
     * Fraction of the asset's replacement value, in [0, 1].
     */
    LOSS_RATIO,

    /**
     * Same monetary unit as the asset value and retrofit cost.
     */
    MONETARY
}
