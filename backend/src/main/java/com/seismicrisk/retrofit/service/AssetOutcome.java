package com.seismicrisk.retrofit.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.seismicrisk.retrofit.domain.model.BenefitCostResult;
import com.seismicrisk.retrofit.domain.model.FailureKind;

/**
 * Result of one asset: either a benefit-cost result or a typed failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetOutcome(
        String assetId,
        BenefitCostResult result,
        FailureKind failure,
        String message
) {

    public static AssetOutcome success(BenefitCostResult result) {
        return new AssetOutcome(result.assetId(), result, null, null);
    }

    public static AssetOutcome failure(String assetId, FailureKind failure, String message) {
        return new AssetOutcome(assetId, null, failure, message);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
