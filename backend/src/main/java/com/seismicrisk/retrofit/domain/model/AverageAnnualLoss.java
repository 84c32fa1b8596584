package com.seismicrisk.retrofit.domain.model;

/**
 * Expected loss per year for one asset under one vulnerability variant.
 */
public record AverageAnnualLoss(
        String assetId,
        VulnerabilityVariant variant,
        double value,
        LossUnit unit
) {}
