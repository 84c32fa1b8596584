package com.seismicrisk.retrofit.service;

import com.seismicrisk.retrofit.domain.model.Asset;
import com.seismicrisk.retrofit.hazard.JobConfiguration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * One retrofit analysis: the job parameters and the assets to evaluate.
 *
 * @param includeLossCurves return the monetary loss curves (and conditional losses) of every asset
 */
public record RetrofitAnalysisRequest(
        @NotNull JobConfiguration configuration,
        @NotEmpty List<@Valid Asset> assets,
        boolean includeLossCurves
) {

    public static RetrofitAnalysisRequest of(JobConfiguration configuration, List<Asset> assets) {
        return new RetrofitAnalysisRequest(configuration, assets, false);
    }
}
