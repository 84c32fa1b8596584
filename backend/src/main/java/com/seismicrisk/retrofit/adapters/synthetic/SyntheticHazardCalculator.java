package com.seismicrisk.retrofit.adapters.synthetic;

import com.seismicrisk.retrofit.adapters.HazardCalculator;
import com.seismicrisk.retrofit.domain.model.HazardCurve;
import com.seismicrisk.retrofit.domain.model.Site;
import com.seismicrisk.retrofit.hazard.CacheKey;
import com.seismicrisk.retrofit.hazard.HazardCurveStore;
import com.seismicrisk.retrofit.hazard.JobConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic stand-in for a PSHA engine, for local runs and demos.
 *
 * Each realization follows a power-law annual rate of exceedance,
 * rate(x) = a * (x / 0.1)^-b, converted to a probability over the investigation
 * time. The amplitude a and slope b are drawn from a Random seeded with the job's
 * random seed and the site id, so the same parameters always give the same curves
 * and the curves of a site do not depend on which other sites are in the job.
 */
@Slf4j
public class SyntheticHazardCalculator implements HazardCalculator {

    static final double[] FULL_ENUMERATION_WEIGHTS = {0.5, 0.3, 0.2};

    private final long simulatedDelayMillis;

    public SyntheticHazardCalculator() {
        this(0L);
    }

    public SyntheticHazardCalculator(long simulatedDelayMillis) {
        this.simulatedDelayMillis = simulatedDelayMillis;
    }

    @Override
    public String getName() {
        return "synthetic";
    }

    @Override
    public HazardCurveStore calculate(CacheKey cacheKey, JobConfiguration configuration) throws InterruptedException {
        log.debug("SYNTHETIC: computing hazard for {} sites, IMTs {}",
                configuration.getSites().size(), configuration.getIntensityMeasureLevels().keySet());

        double[] weights = realizationWeights(configuration.getNumberOfLogicTreeSamples());
        HazardCurveStore.Builder builder = HazardCurveStore.builder(cacheKey);
        for (int r = 0; r < weights.length; r++) {
            builder.weight(realizationId(r), weights[r]);
        }

        for (Site site : configuration.getSites()) {
            Random random = new Random(configuration.getRandomSeed() * 31 + site.id().hashCode());
            for (Map.Entry<String, List<Double>> imt : configuration.getIntensityMeasureLevels().entrySet()) {
                double[] levels = imt.getValue().stream().mapToDouble(Double::doubleValue).toArray();
                for (int r = 0; r < weights.length; r++) {
                    if (Thread.interrupted()) {
                        throw new InterruptedException("Synthetic hazard computation interrupted");
                    }
                    double amplitude = 0.02 + random.nextDouble() * 0.08;
                    double slope = 1.5 + random.nextDouble() * 1.5;
                    builder.curve(new HazardCurve(site.id(), imt.getKey(), realizationId(r), levels,
                            poes(levels, amplitude, slope, configuration.getInvestigationTime())));
                }
            }
            if (simulatedDelayMillis > 0) {
                Thread.sleep(simulatedDelayMillis);
            }
        }
        return builder.build();
    }

    private static double[] realizationWeights(int samples) {
        if (samples <= 0) {
            return FULL_ENUMERATION_WEIGHTS.clone();
        }
        double[] weights = new double[samples];
        Arrays.fill(weights, 1.0 / samples);
        return weights;
    }

    private static double[] poes(double[] levels, double amplitude, double slope, double investigationTime) {
        double[] poes = new double[levels.length];
        for (int i = 0; i < levels.length; i++) {
            double rate = amplitude * Math.pow(levels[i] / 0.1, -slope);
            poes[i] = -Math.expm1(-rate * investigationTime);
        }
        return poes;
    }

    private static String realizationId(int index) {
        return String.format("rlz-%03d", index);
    }
}
