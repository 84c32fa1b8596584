package com.seismicrisk.retrofit.aggregation;

import com.seismicrisk.retrofit.domain.model.HazardCurve;
import com.seismicrisk.retrofit.loss.CurveValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Combines the per-realization hazard curves of one (site, IMT) into statistics.
 *
 * ALGORITHM:
 * 1. Validate every input curve
 * 2. Resample all realizations onto the union of their intensity levels
 * 3. Mean PoE per level = sum of weight * PoE, summed in realization-id order so the
 *    result is bit-reproducible regardless of input order
 * 4. Weighted quantiles: first value whose cumulative weight reaches q
 * 5. Individual curves only on request, after a resource warning for large N
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealizationAggregator {

    private static final double QUANTILE_TOLERANCE = 1e-9;

    private final CurveValidator curveValidator;
    private final AggregationProperties properties;

    public HazardStatistics meanOnly(List<HazardCurve> curves, Map<String, Double> weights) {
        return aggregate(curves, weights, List.of(), false);
    }

    public HazardStatistics aggregate(List<HazardCurve> curves,
                                      Map<String, Double> weights,
                                      List<Double> quantiles,
                                      boolean individualCurves) {
        if (curves.isEmpty()) {
            throw new IllegalArgumentException("No realizations to aggregate");
        }
        String siteId = curves.get(0).siteId();
        String imt = curves.get(0).intensityMeasureType();

        List<HazardCurve> ordered = new ArrayList<>(curves);
        ordered.sort(Comparator.comparing(HazardCurve::realizationId));
        double[] curveWeights = checkInputs(ordered, weights, siteId, imt);
        for (double q : quantiles) {
            if (!(q >= 0.0 && q <= 1.0)) {
                throw new IllegalArgumentException("Quantile must be in [0, 1]: " + q);
            }
        }
        ordered.forEach(curveValidator::validate);

        double[] support = CurveResampler.unionSupport(ordered.stream()
                .map(HazardCurve::levels)
                .toArray(double[][]::new));
        double[][] resampled = new double[ordered.size()][];
        for (int r = 0; r < ordered.size(); r++) {
            HazardCurve curve = ordered.get(r);
            resampled[r] = CurveResampler.resample(curve.levels(), curve.poes(), support);
        }

        double[] mean = new double[support.length];
        for (int r = 0; r < resampled.length; r++) {
            for (int i = 0; i < support.length; i++) {
                mean[i] += curveWeights[r] * resampled[r][i];
            }
        }
        HazardCurve meanCurve = new HazardCurve(siteId, imt, HazardCurve.MEAN, support, mean);

        Map<Double, HazardCurve> quantileCurves = new TreeMap<>();
        for (double q : quantiles) {
            quantileCurves.put(q, new HazardCurve(siteId, imt, HazardCurve.quantileLabel(q), support,
                    weightedQuantile(resampled, curveWeights, q)));
        }

        List<String> warnings = new ArrayList<>();
        List<HazardCurve> individual = new ArrayList<>();
        if (individualCurves) {
            if (ordered.size() > properties.getIndividualCurvesWarningThreshold()) {
                String warning = String.format(
                        "Individual curves requested for %d realizations at site %s (%s): about %d values will be held in memory",
                        ordered.size(), siteId, imt, (long) ordered.size() * support.length);
                log.warn(warning);
                warnings.add(warning);
            }
            for (int r = 0; r < ordered.size(); r++) {
                individual.add(new HazardCurve(siteId, imt, ordered.get(r).realizationId(), support, resampled[r]));
            }
        }

        log.debug("Aggregated {} realizations for {}/{} onto {} levels", ordered.size(), siteId, imt, support.length);
        return new HazardStatistics(siteId, imt, meanCurve, quantileCurves, individual, warnings);
    }

    private double[] checkInputs(List<HazardCurve> ordered, Map<String, Double> weights, String siteId, String imt) {
        double[] curveWeights = new double[ordered.size()];
        double total = 0.0;
        for (int r = 0; r < ordered.size(); r++) {
            HazardCurve curve = ordered.get(r);
            if (!curve.siteId().equals(siteId) || !curve.intensityMeasureType().equals(imt)) {
                throw new IllegalArgumentException(String.format(
                        "Cannot aggregate %s/%s together with %s/%s",
                        curve.siteId(), curve.intensityMeasureType(), siteId, imt));
            }
            if (r > 0 && curve.realizationId().equals(ordered.get(r - 1).realizationId())) {
                throw new IllegalArgumentException("Duplicate realization " + curve.realizationId());
            }
            Double weight = weights.get(curve.realizationId());
            if (weight == null) {
                throw new IllegalArgumentException("No weight for realization " + curve.realizationId());
            }
            curveWeights[r] = weight;
            total += weight;
        }
        if (Math.abs(total - 1.0) > properties.getWeightTolerance()) {
            throw new IllegalArgumentException(String.format(
                    "Realization weights for %s/%s sum to %.9f, expected 1", siteId, imt, total));
        }
        return curveWeights;
    }

    private static double[] weightedQuantile(double[][] values, double[] weights, double q) {
        int levels = values[0].length;
        double[] result = new double[levels];
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < levels; i++) {
            final int level = i;
            for (int r = 0; r < order.length; r++) {
                order[r] = r;
            }
            Arrays.sort(order, Comparator.comparingDouble(r -> values[r][level]));
            double cumulative = 0.0;
            result[i] = values[order[order.length - 1]][level];
            for (Integer r : order) {
                cumulative += weights[r];
                if (cumulative >= q - QUANTILE_TOLERANCE) {
                    result[i] = values[r][level];
                    break;
                }
            }
        }
        return result;
    }
}
