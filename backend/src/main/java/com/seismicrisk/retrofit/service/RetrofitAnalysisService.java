package com.seismicrisk.retrofit.service;

import com.seismicrisk.retrofit.aggregation.HazardMapExtractor;
import com.seismicrisk.retrofit.aggregation.HazardStatistics;
import com.seismicrisk.retrofit.aggregation.RealizationAggregator;
import com.seismicrisk.retrofit.domain.error.MissingInputException;
import com.seismicrisk.retrofit.domain.error.RiskComputationException;
import com.seismicrisk.retrofit.domain.model.Asset;
import com.seismicrisk.retrofit.domain.model.AverageAnnualLoss;
import com.seismicrisk.retrofit.domain.model.BenefitCostResult;
import com.seismicrisk.retrofit.domain.model.FailureKind;
import com.seismicrisk.retrofit.domain.model.LossExceedanceCurve;
import com.seismicrisk.retrofit.domain.model.RetrofitEconomics;
import com.seismicrisk.retrofit.domain.model.VulnerabilityFunction;
import com.seismicrisk.retrofit.domain.model.VulnerabilityModel;
import com.seismicrisk.retrofit.domain.model.VulnerabilityVariant;
import com.seismicrisk.retrofit.domain.repository.VulnerabilityModelRegistry;
import com.seismicrisk.retrofit.economics.BenefitCostCalculator;
import com.seismicrisk.retrofit.hazard.HazardCurveStore;
import com.seismicrisk.retrofit.hazard.HazardLookup;
import com.seismicrisk.retrofit.hazard.HazardReuseController;
import com.seismicrisk.retrofit.hazard.JobConfiguration;
import com.seismicrisk.retrofit.loss.ConditionalLossCalculator;
import com.seismicrisk.retrofit.loss.ConvolutionSettings;
import com.seismicrisk.retrofit.loss.LossIntegrator;
import com.seismicrisk.retrofit.loss.VulnerabilityConvolutionEngine;
import com.seismicrisk.retrofit.service.RetrofitAnalysisResult.AssetLossCurves;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs the retrofit analysis pipeline for a batch of assets.
 *
 * PIPELINE:
 * 1. Resolve the original and retrofitted vulnerability models
 * 2. Obtain the hazard store (cached, computed, or joined) from the reuse controller
 * 3. Aggregate every (site, IMT) group on the worker pool; barrier
 * 4. Per asset, convolve both vulnerability variants concurrently into loss-ratio
 *    curves; barrier; scale to money, integrate to AALs, benefit-cost
 * 5. Hazard maps for the mean and every requested quantile curve
 *
 * FAILURE MODEL:
 * - Unknown vulnerability model, bad weights, hazard failure, cancellation: the
 *   whole batch fails
 * - Anything that goes wrong for one asset is recorded as that asset's outcome and
 *   the rest of the batch carries on
 *
 * Every stage is a pure function of its inputs, so the result does not depend on
 * scheduling or on whether the hazard came from cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrofitAnalysisService {

    private final VulnerabilityModelRegistry modelRegistry;
    private final HazardReuseController hazardReuseController;
    private final RealizationAggregator aggregator;
    private final HazardMapExtractor hazardMapExtractor;
    private final VulnerabilityConvolutionEngine convolutionEngine;
    private final LossIntegrator lossIntegrator;
    private final ConditionalLossCalculator conditionalLossCalculator;
    private final BenefitCostCalculator benefitCostCalculator;
    private final RiskWorkerPool workerPool;

    public RetrofitAnalysisResult analyze(RetrofitAnalysisRequest request) {
        JobConfiguration config = request.configuration();
        if (config == null) {
            throw new IllegalArgumentException("Job configuration is required");
        }
        checkDistinctAssetIds(request.assets());

        VulnerabilityModel original = resolveModel(config.getOriginalVulnerabilityModel(), "originalVulnerabilityModel");
        VulnerabilityModel retrofitted = resolveModel(config.getRetrofittedVulnerabilityModel(),
                "retrofittedVulnerabilityModel");

        log.info("Starting retrofit analysis of {} assets ({} vs {})",
                request.assets().size(), original.reference(), retrofitted.reference());

        HazardLookup lookup = hazardReuseController.obtain(config);
        HazardCurveStore store = lookup.store();
        Executor executor = workerPool.executor();

        GroupStatistics groups = aggregateGroups(store, config, executor);
        List<String> warnings = new ArrayList<>(groups.warnings());
        if (lookup.inconsistencyRecovered()) {
            warnings.add("Hazard cache entry " + lookup.cacheKey().shortForm()
                    + " was inconsistent and has been recomputed");
        }

        ConvolutionSettings settings = new ConvolutionSettings(
                config.getBinRepresentative(), config.getLossCurveResolution(), config.getLossRatioSamples());
        AssetContext context = new AssetContext(config, store, groups, settings, original, retrofitted,
                request.includeLossCurves(), executor);

        Map<String, CompletableFuture<AssetAnalysis>> perAsset = new LinkedHashMap<>();
        for (Asset asset : request.assets()) {
            perAsset.put(asset.id(), analyzeAsset(asset, context));
        }
        CompletableFuture.allOf(perAsset.values().toArray(CompletableFuture[]::new)).join();

        Map<String, AssetOutcome> outcomes = new LinkedHashMap<>();
        Map<String, AssetLossCurves> lossCurves = new LinkedHashMap<>();
        Map<FailureKind, Long> failureSummary = new EnumMap<>(FailureKind.class);
        perAsset.forEach((assetId, future) -> {
            AssetAnalysis analysis = future.join();
            outcomes.put(assetId, analysis.outcome());
            if (analysis.lossCurves() != null) {
                lossCurves.put(assetId, analysis.lossCurves());
            }
            if (!analysis.outcome().isSuccess()) {
                failureSummary.merge(analysis.outcome().failure(), 1L, Long::sum);
            }
        });

        boolean statisticsRequested = config.isIndividualCurves() || !config.getQuantiles().isEmpty();
        Map<String, Map<Double, Double>> hazardMaps = new LinkedHashMap<>();
        Map<String, Map<Double, Map<Double, Double>>> quantileHazardMaps = new LinkedHashMap<>();
        List<Double> mapPoes = config.getHazardMapPoes();
        if (!mapPoes.isEmpty()) {
            groups.statistics().forEach((group, stats) -> {
                hazardMaps.put(group.label(), hazardMapExtractor.extract(stats.mean(), mapPoes));
                if (!stats.quantiles().isEmpty()) {
                    Map<Double, Map<Double, Double>> perQuantile = new LinkedHashMap<>();
                    stats.quantiles().forEach((quantile, curve) ->
                            perQuantile.put(quantile, hazardMapExtractor.extract(curve, mapPoes)));
                    quantileHazardMaps.put(group.label(), perQuantile);
                }
            });
        }

        RetrofitAnalysisResult result = new RetrofitAnalysisResult(
                lookup.cacheKey().value(),
                lookup.source(),
                lookup.inconsistencyRecovered(),
                outcomes,
                failureSummary,
                warnings,
                statisticsRequested ? List.copyOf(groups.statistics().values()) : List.of(),
                hazardMaps,
                quantileHazardMaps,
                lossCurves);

        log.info("Retrofit analysis complete: {} succeeded, {} failed, hazard {} ({})",
                result.successCount(), result.failureCount(), lookup.source(), lookup.cacheKey().shortForm());
        return result;
    }

    private VulnerabilityModel resolveModel(String reference, String parameter) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException(parameter + " is required");
        }
        return modelRegistry.findByReference(reference)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown vulnerability model '" + reference + "' for " + parameter));
    }

    private static void checkDistinctAssetIds(List<Asset> assets) {
        if (assets == null || assets.isEmpty()) {
            throw new IllegalArgumentException("At least one asset is required");
        }
        Set<String> seen = new HashSet<>();
        for (Asset asset : assets) {
            if (!seen.add(asset.id())) {
                throw new IllegalArgumentException("Duplicate asset id " + asset.id());
            }
        }
    }

    private GroupStatistics aggregateGroups(HazardCurveStore store, JobConfiguration config, Executor executor) {
        Map<SiteImt, CompletableFuture<HazardStatistics>> futures = new LinkedHashMap<>();
        for (String siteId : store.siteIds()) {
            for (String imt : store.intensityMeasureTypes(siteId)) {
                futures.put(new SiteImt(siteId, imt), CompletableFuture.supplyAsync(
                        () -> aggregator.aggregate(store.curves(siteId, imt), store.weights(),
                                config.getQuantiles(), config.isIndividualCurves()),
                        executor));
            }
        }
        CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
                .exceptionally(error -> null)
                .join();

        Map<SiteImt, HazardStatistics> statistics = new LinkedHashMap<>();
        Map<SiteImt, RiskComputationException> failed = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<SiteImt, CompletableFuture<HazardStatistics>> entry : futures.entrySet()) {
            try {
                HazardStatistics stats = entry.getValue().join();
                statistics.put(entry.getKey(), stats);
                warnings.addAll(stats.warnings());
            } catch (CompletionException e) {
                Throwable cause = unwrap(e);
                if (cause instanceof RiskComputationException risk) {
                    log.warn("Hazard group {} unusable: {}", entry.getKey().label(), risk.getMessage());
                    failed.put(entry.getKey(), risk);
                } else if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                } else {
                    throw e;
                }
            }
        }
        log.debug("Aggregated {} hazard groups ({} unusable)", statistics.size(), failed.size());
        return new GroupStatistics(statistics, failed, warnings);
    }

    private CompletableFuture<AssetAnalysis> analyzeAsset(Asset asset, AssetContext context) {
        CompletableFuture<LossExceedanceCurve> originalCurve = CompletableFuture.supplyAsync(
                () -> lossRatioCurve(asset, context.original(), context), context.executor());
        CompletableFuture<LossExceedanceCurve> retrofittedCurve = CompletableFuture.supplyAsync(
                () -> lossRatioCurve(asset, context.retrofitted(), context), context.executor());

        return originalCurve
                .thenCombine(retrofittedCurve, (original, retrofitted) -> benefitCost(asset, original, retrofitted, context))
                .handle((analysis, error) -> error == null ? analysis : new AssetAnalysis(failure(asset, error), null));
    }

    private LossExceedanceCurve lossRatioCurve(Asset asset, VulnerabilityModel model, AssetContext context) {
        VulnerabilityFunction function = model.functionFor(asset.taxonomy())
                .orElseThrow(() -> new MissingInputException(String.format(
                        "Vulnerability model %s has no function for taxonomy %s", model.reference(), asset.taxonomy())));

        List<String> imts = context.store().intensityMeasureTypes(asset.siteId());
        if (imts.isEmpty()) {
            throw new MissingInputException("No hazard curves for site " + asset.siteId());
        }
        // Without curves for the function's IMT the engine reports the mismatch
        String imt = imts.contains(function.intensityMeasureType()) ? function.intensityMeasureType() : imts.get(0);
        SiteImt group = new SiteImt(asset.siteId(), imt);

        RiskComputationException groupFailure = context.groups().failed().get(group);
        if (groupFailure != null) {
            throw new RiskComputationException(groupFailure.getKind(),
                    "Hazard for " + group.label() + " is unusable: " + groupFailure.getMessage(), groupFailure);
        }
        HazardStatistics statistics = context.groups().statistics().get(group);

        LossExceedanceCurve ratioCurve = convolutionEngine.convolve(
                asset.id(), statistics.mean(), function, context.settings());
        log.debug("Asset {} ({}): {} loss points", asset.id(), model.variant(), ratioCurve.size());
        return ratioCurve;
    }

    private AssetAnalysis benefitCost(Asset asset, LossExceedanceCurve originalRatio,
                                      LossExceedanceCurve retrofittedRatio, AssetContext context) {
        LossExceedanceCurve original = originalRatio.toMonetary(asset.value());
        LossExceedanceCurve retrofitted = retrofittedRatio.toMonetary(asset.value());
        AverageAnnualLoss aalOriginal = lossIntegrator.averageAnnualLoss(original, VulnerabilityVariant.ORIGINAL);
        AverageAnnualLoss aalRetrofitted = lossIntegrator.averageAnnualLoss(retrofitted, VulnerabilityVariant.RETROFITTED);

        JobConfiguration config = context.configuration();
        BenefitCostResult result = benefitCostCalculator.calculate(aalOriginal, aalRetrofitted,
                new RetrofitEconomics(asset.id(), config.getInterestRate(), config.getLifeExpectancy(),
                        asset.retrofitCost()));

        AssetLossCurves curves = null;
        if (context.includeLossCurves()) {
            List<Double> poes = config.getConditionalLossPoes();
            curves = new AssetLossCurves(original, retrofitted, originalRatio, retrofittedRatio,
                    conditionalLossCalculator.conditionalLosses(original, poes),
                    conditionalLossCalculator.conditionalLosses(retrofitted, poes));
        }
        return new AssetAnalysis(AssetOutcome.success(result), curves);
    }

    private AssetOutcome failure(Asset asset, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RiskComputationException risk) {
            log.warn("Asset {} failed with {}: {}", asset.id(), risk.getKind(), risk.getMessage());
            return AssetOutcome.failure(asset.id(), risk.getKind(), risk.getMessage());
        }
        log.error("Unexpected failure analysing asset {}", asset.id(), cause);
        return AssetOutcome.failure(asset.id(), FailureKind.INTERNAL, String.valueOf(cause.getMessage()));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record SiteImt(String siteId, String imt) {
        String label() {
            return siteId + "/" + imt;
        }
    }

    private record GroupStatistics(
            Map<SiteImt, HazardStatistics> statistics,
            Map<SiteImt, RiskComputationException> failed,
            List<String> warnings
    ) {}

    private record AssetContext(
            JobConfiguration configuration,
            HazardCurveStore store,
            GroupStatistics groups,
            ConvolutionSettings settings,
            VulnerabilityModel original,
            VulnerabilityModel retrofitted,
            boolean includeLossCurves,
            Executor executor
    ) {}

    private record AssetAnalysis(AssetOutcome outcome, AssetLossCurves lossCurves) {}
}
