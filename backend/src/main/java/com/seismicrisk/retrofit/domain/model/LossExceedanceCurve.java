package com.seismicrisk.retrofit.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Annual probability of exceeding each of a set of loss values for one asset.
 *
 * Points are stored sorted by loss (ties by descending probability) regardless of the
 * order they were supplied in. Instances are derived values and never change after creation.
 */
public record LossExceedanceCurve(
        String assetId,
        LossUnit unit,
        double[] losses,
        double[] poes
) {

    public LossExceedanceCurve {
        Objects.requireNonNull(assetId, "assetId");
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(losses, "losses");
        Objects.requireNonNull(poes, "poes");
        if (losses.length != poes.length) {
            throw new IllegalArgumentException(String.format(
                    "Loss curve for asset %s has %d losses but %d probabilities",
                    assetId, losses.length, poes.length));
        }
        double[][] sorted = sortByLoss(losses, poes);
        losses = sorted[0];
        poes = sorted[1];
    }

    private static double[][] sortByLoss(double[] losses, double[] poes) {
        Integer[] order = new Integer[losses.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> losses[i])
                .thenComparing(Comparator.<Integer>comparingDouble(i -> poes[i]).reversed()));
        double[] sortedLosses = new double[losses.length];
        double[] sortedPoes = new double[poes.length];
        for (int i = 0; i < order.length; i++) {
            sortedLosses[i] = losses[order[i]];
            sortedPoes[i] = poes[order[i]];
        }
        return new double[][]{sortedLosses, sortedPoes};
    }

    @Override
    public double[] losses() {
        return losses.clone();
    }

    @Override
    public double[] poes() {
        return poes.clone();
    }

    public int size() {
        return losses.length;
    }

    public double lossAt(int index) {
        return losses[index];
    }

    public double poeAt(int index) {
        return poes[index];
    }

    /**
     * Scales a loss-ratio curve by the asset's replacement value.
     */
    public LossExceedanceCurve toMonetary(double assetValue) {
        if (unit == LossUnit.MONETARY) {
            return this;
        }
        double[] scaled = new double[losses.length];
        for (int i = 0; i < losses.length; i++) {
            scaled[i] = losses[i] * assetValue;
        }
        return new LossExceedanceCurve(assetId, LossUnit.MONETARY, scaled, poes);
    }

    public List<String> monotonicityViolations() {
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < poes.length; i++) {
            if (Double.isNaN(poes[i]) || poes[i] < 0.0 || poes[i] > 1.0) {
                violations.add(String.format("poe %.6g at loss %.6g is outside [0, 1]", poes[i], losses[i]));
            }
            if (i > 0 && poes[i] > poes[i - 1]) {
                violations.add(String.format("poe increases from %.6g to %.6g between losses %.6g and %.6g",
                        poes[i - 1], poes[i], losses[i - 1], losses[i]));
            }
        }
        return violations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LossExceedanceCurve that)) return false;
        return assetId.equals(that.assetId) &&
               unit == that.unit &&
               Arrays.equals(losses, that.losses) &&
               Arrays.equals(poes, that.poes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(assetId, unit);
        result = 31 * result + Arrays.hashCode(losses);
        result = 31 * result + Arrays.hashCode(poes);
        return result;
    }

    @Override
    public String toString() {
        return "LossExceedanceCurve[asset=" + assetId + ", unit=" + unit +
               ", losses=" + Arrays.toString(losses) + ", poes=" + Arrays.toString(poes) + "]";
    }
}
