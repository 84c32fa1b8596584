package com.seismicrisk.retrofit.service;

import com.seismicrisk.retrofit.aggregation.HazardStatistics;
import com.seismicrisk.retrofit.domain.model.FailureKind;
import com.seismicrisk.retrofit.domain.model.LossExceedanceCurve;
import com.seismicrisk.retrofit.hazard.HazardSource;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a retrofit analysis batch.
 *
 * @param outcomes       per-asset outcome, in the order the assets were submitted
 * @param failureSummary number of failed assets per failure kind
 * @param hazardMaps     intensity per target PoE on the mean curve, keyed by "site/IMT"; empty unless requested
 * @param quantileHazardMaps intensity per target PoE on each quantile curve, keyed by "site/IMT" then quantile;
 *                       empty unless both hazard maps and quantiles are requested
 * @param lossCurves     per-asset loss curves; empty unless requested
 */
public record RetrofitAnalysisResult(
        String cacheKey,
        HazardSource hazardSource,
        boolean hazardCacheRecovered,
        Map<String, AssetOutcome> outcomes,
        Map<FailureKind, Long> failureSummary,
        List<String> warnings,
        List<HazardStatistics> hazardStatistics,
        Map<String, Map<Double, Double>> hazardMaps,
        Map<String, Map<Double, Map<Double, Double>>> quantileHazardMaps,
        Map<String, AssetLossCurves> lossCurves
) {

    public long successCount() {
        return outcomes.values().stream().filter(AssetOutcome::isSuccess).count();
    }

    public long failureCount() {
        return outcomes.size() - successCount();
    }

    /**
     * Loss curves of one asset, monetary and as loss ratios, with monetary losses at the
     * requested target PoEs.
     */
    public record AssetLossCurves(
            LossExceedanceCurve original,
            LossExceedanceCurve retrofitted,
            LossExceedanceCurve originalLossRatio,
            LossExceedanceCurve retrofittedLossRatio,
            Map<Double, Double> conditionalLossesOriginal,
            Map<Double, Double> conditionalLossesRetrofitted
    ) {}
}
