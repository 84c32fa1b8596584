package com.seismicrisk.retrofit.loss;

import com.seismicrisk.retrofit.domain.model.LossExceedanceCurve;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loss at a target annual probability of exceedance, read off a loss curve by linear
 * interpolation. Targets above the first PoE give the first loss, targets below the
 * last PoE give the last loss.
 */
@Component
public class ConditionalLossCalculator {

    public Map<Double, Double> conditionalLosses(LossExceedanceCurve curve, List<Double> targetPoes) {
        Map<Double, Double> losses = new LinkedHashMap<>();
        for (Double poe : targetPoes) {
            losses.put(poe, lossAt(curve, poe));
        }
        return losses;
    }

    public double lossAt(LossExceedanceCurve curve, double poe) {
        if (curve.size() == 0) {
            throw new IllegalArgumentException("Empty loss curve for asset " + curve.assetId());
        }
        int last = curve.size() - 1;
        if (poe >= curve.poeAt(0)) {
            return curve.lossAt(0);
        }
        if (poe <= curve.poeAt(last)) {
            return curve.lossAt(last);
        }
        for (int k = 0; k < last; k++) {
            double p0 = curve.poeAt(k);
            double p1 = curve.poeAt(k + 1);
            if (p0 >= poe && poe >= p1 && p0 > p1) {
                double t = (p0 - poe) / (p0 - p1);
                return curve.lossAt(k) + t * (curve.lossAt(k + 1) - curve.lossAt(k));
            }
        }
        return curve.lossAt(last);
    }
}
