package com.seismicrisk.retrofit.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Annual probability of exceeding each of a set of ground-motion intensity levels at one site.
 *
 * A curve belongs to one logic-tree realization, or carries a statistic label
 * ("mean", "quantile-0.85") when it was produced by aggregation.
 *
 * INVARIANTS:
 * - Intensity levels are strictly increasing (enforced here).
 * - Probabilities are non-increasing in intensity (detected, not enforced;
 *   see {@link #monotonicityViolations()}).
 *
 * Arrays are copied on the way in and on the way out, so instances are immutable.
 */
public record HazardCurve(
        String siteId,
        String intensityMeasureType,
        String realizationId,
        double[] levels,
        double[] poes
) {

    public static final String MEAN = "mean";

    public HazardCurve {
        Objects.requireNonNull(siteId, "siteId");
        Objects.requireNonNull(intensityMeasureType, "intensityMeasureType");
        Objects.requireNonNull(realizationId, "realizationId");
        Objects.requireNonNull(levels, "levels");
        Objects.requireNonNull(poes, "poes");
        if (levels.length != poes.length) {
            throw new IllegalArgumentException(String.format(
                    "Hazard curve for site %s has %d levels but %d probabilities",
                    siteId, levels.length, poes.length));
        }
        for (int i = 1; i < levels.length; i++) {
            if (!(levels[i] > levels[i - 1])) {
                throw new IllegalArgumentException(String.format(
                        "Intensity levels of hazard curve for site %s must be strictly increasing (index %d)",
                        siteId, i));
            }
        }
        levels = levels.clone();
        poes = poes.clone();
    }

    public static String quantileLabel(double quantile) {
        return "quantile-" + quantile;
    }

    @Override
    public double[] levels() {
        return levels.clone();
    }

    @Override
    public double[] poes() {
        return poes.clone();
    }

    public int size() {
        return levels.length;
    }

    public double levelAt(int index) {
        return levels[index];
    }

    public double poeAt(int index) {
        return poes[index];
    }

    /**
     * Returns a human-readable description of every place where the curve breaks the
     * exceedance-probability invariants. Empty for a well-formed curve.
     */
    public List<String> monotonicityViolations() {
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < poes.length; i++) {
            if (Double.isNaN(poes[i]) || poes[i] < 0.0 || poes[i] > 1.0) {
                violations.add(String.format("poe %.6g at level %.6g is outside [0, 1]", poes[i], levels[i]));
            }
            if (i > 0 && poes[i] > poes[i - 1]) {
                violations.add(String.format("poe increases from %.6g to %.6g between levels %.6g and %.6g",
                        poes[i - 1], poes[i], levels[i - 1], levels[i]));
            }
        }
        return violations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HazardCurve that)) return false;
        return siteId.equals(that.siteId) &&
               intensityMeasureType.equals(that.intensityMeasureType) &&
               realizationId.equals(that.realizationId) &&
               Arrays.equals(levels, that.levels) &&
               Arrays.equals(poes, that.poes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(siteId, intensityMeasureType, realizationId);
        result = 31 * result + Arrays.hashCode(levels);
        result = 31 * result + Arrays.hashCode(poes);
        return result;
    }

    @Override
    public String toString() {
        return "HazardCurve[site=" + siteId + ", imt=" + intensityMeasureType +
               ", realization=" + realizationId + ", levels=" + Arrays.toString(levels) +
               ", poes=" + Arrays.toString(poes) + "]";
    }
}
