package com.seismicrisk.retrofit.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.seismicrisk.retrofit.aggregation.CurveResampler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Mapping from ground-motion intensity to a loss-ratio distribution for one asset class.
 *
 * Each tabulated level carries a mean loss ratio and a coefficient of variation.
 * Well-formed functions have loss ratios in [0, 1] that never decrease with intensity;
 * this is not enforced on construction but reported by {@link #lossRatioViolations()}.
 */
public record VulnerabilityFunction(
        String taxonomy,
        String intensityMeasureType,
        double[] levels,
        double[] meanLossRatios,
        double[] coefficientsOfVariation
) {

    @JsonCreator
    public VulnerabilityFunction(
            @JsonProperty("taxonomy") String taxonomy,
            @JsonProperty("intensityMeasureType") String intensityMeasureType,
            @JsonProperty("levels") double[] levels,
            @JsonProperty("meanLossRatios") double[] meanLossRatios,
            @JsonProperty("coefficientsOfVariation") double[] coefficientsOfVariation
    ) {
        Objects.requireNonNull(taxonomy, "taxonomy");
        Objects.requireNonNull(intensityMeasureType, "intensityMeasureType");
        Objects.requireNonNull(levels, "levels");
        Objects.requireNonNull(meanLossRatios, "meanLossRatios");
        if (coefficientsOfVariation == null) {
            coefficientsOfVariation = new double[levels.length];
        }
        if (levels.length == 0) {
            throw new IllegalArgumentException("Vulnerability function " + taxonomy + " has no levels");
        }
        if (meanLossRatios.length != levels.length || coefficientsOfVariation.length != levels.length) {
            throw new IllegalArgumentException(String.format(
                    "Vulnerability function %s has %d levels, %d loss ratios and %d coefficients",
                    taxonomy, levels.length, meanLossRatios.length, coefficientsOfVariation.length));
        }
        for (int i = 1; i < levels.length; i++) {
            if (!(levels[i] > levels[i - 1])) {
                throw new IllegalArgumentException(String.format(
                        "Intensity levels of vulnerability function %s must be strictly increasing (index %d)",
                        taxonomy, i));
            }
        }
        this.taxonomy = taxonomy;
        this.intensityMeasureType = intensityMeasureType;
        this.levels = levels.clone();
        this.meanLossRatios = meanLossRatios.clone();
        this.coefficientsOfVariation = coefficientsOfVariation.clone();
    }

    /**
     * Function with no loss-ratio uncertainty.
     */
    public static VulnerabilityFunction deterministic(String taxonomy, String imt,
                                                      double[] levels, double[] meanLossRatios) {
        return new VulnerabilityFunction(taxonomy, imt, levels, meanLossRatios, new double[levels.length]);
    }

    @Override
    public double[] levels() {
        return levels.clone();
    }

    @Override
    public double[] meanLossRatios() {
        return meanLossRatios.clone();
    }

    @Override
    public double[] coefficientsOfVariation() {
        return coefficientsOfVariation.clone();
    }

    /**
     * Mean loss ratio at an arbitrary intensity.
     * Zero below the first tabulated level, clamped to the last value above the last level,
     * linear in between.
     */
    public double meanLossRatioAt(double intensity) {
        return interpolate(meanLossRatios, intensity);
    }

    public double coefficientOfVariationAt(double intensity) {
        return interpolate(coefficientsOfVariation, intensity);
    }

    private double interpolate(double[] values, double intensity) {
        if (intensity < levels[0]) {
            return 0.0;
        }
        return CurveResampler.valueAt(levels, values, intensity);
    }

    /**
     * Data-quality problems of this function. Empty for a well-formed function.
     */
    public List<String> lossRatioViolations() {
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < levels.length; i++) {
            double lr = meanLossRatios[i];
            if (Double.isNaN(lr) || lr < 0.0 || lr > 1.0) {
                violations.add(String.format("loss ratio %.6g at level %.6g is outside [0, 1]", lr, levels[i]));
            }
            if (i > 0 && lr < meanLossRatios[i - 1]) {
                violations.add(String.format("loss ratio decreases from %.6g to %.6g between levels %.6g and %.6g",
                        meanLossRatios[i - 1], lr, levels[i - 1], levels[i]));
            }
            if (coefficientsOfVariation[i] < 0.0 || Double.isNaN(coefficientsOfVariation[i])) {
                violations.add(String.format("coefficient of variation %.6g at level %.6g is negative",
                        coefficientsOfVariation[i], levels[i]));
            }
        }
        return violations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VulnerabilityFunction that)) return false;
        return taxonomy.equals(that.taxonomy) &&
               intensityMeasureType.equals(that.intensityMeasureType) &&
               Arrays.equals(levels, that.levels) &&
               Arrays.equals(meanLossRatios, that.meanLossRatios) &&
               Arrays.equals(coefficientsOfVariation, that.coefficientsOfVariation);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(taxonomy, intensityMeasureType);
        result = 31 * result + Arrays.hashCode(levels);
        result = 31 * result + Arrays.hashCode(meanLossRatios);
        result = 31 * result + Arrays.hashCode(coefficientsOfVariation);
        return result;
    }

    @Override
    public String toString() {
        return "VulnerabilityFunction[taxonomy=" + taxonomy + ", imt=" + intensityMeasureType +
               ", levels=" + Arrays.toString(levels) + ", meanLossRatios=" + Arrays.toString(meanLossRatios) + "]";
    }
}
