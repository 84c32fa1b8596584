package com.seismicrisk.retrofit.domain.model;

/**
 * Economic inputs of a retrofit decision for one asset.
 *
 * @param interestRate   annual discount rate as a decimal (0.05 = 5%)
 * @param lifeExpectancy remaining life of the structure in years
 * @param retrofitCost   cost of the retrofit, in the asset's monetary unit
 */
public record RetrofitEconomics(
        String assetId,
        double interestRate,
        int lifeExpectancy,
        double retrofitCost
) {}
