package com.seismicrisk.retrofit.aggregation;

import com.seismicrisk.retrofit.domain.model.HazardCurve;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads hazard maps off a hazard curve: the intensity with a given annual probability
 * of exceedance.
 *
 * Interpolation is log-log between the bracketing points, linear when one of them has
 * zero probability. Targets above the first PoE give the first level; targets below
 * the last PoE give the last level.
 */
@Component
public class HazardMapExtractor {

    /**
     * Intensity per target PoE, in the order the targets were given.
     */
    public Map<Double, Double> extract(HazardCurve curve, List<Double> targetPoes) {
        Map<Double, Double> map = new LinkedHashMap<>();
        for (Double poe : targetPoes) {
            map.put(poe, intensityAt(curve, poe));
        }
        return map;
    }

    public double intensityAt(HazardCurve curve, double poe) {
        if (curve.size() == 0) {
            throw new IllegalArgumentException("Empty hazard curve for site " + curve.siteId());
        }
        if (!(poe > 0.0 && poe <= 1.0)) {
            throw new IllegalArgumentException("Target probability must be in (0, 1]: " + poe);
        }
        int last = curve.size() - 1;
        if (poe >= curve.poeAt(0)) {
            return curve.levelAt(0);
        }
        if (poe <= curve.poeAt(last)) {
            return curve.levelAt(last);
        }
        for (int i = 0; i < last; i++) {
            double p0 = curve.poeAt(i);
            double p1 = curve.poeAt(i + 1);
            if (p0 >= poe && poe >= p1 && p0 > p1) {
                return interpolate(curve.levelAt(i), curve.levelAt(i + 1), p0, p1, poe);
            }
        }
        return curve.levelAt(last);
    }

    private static double interpolate(double x0, double x1, double p0, double p1, double poe) {
        if (p0 > 0.0 && p1 > 0.0 && x0 > 0.0 && x1 > 0.0) {
            double t = (Math.log(poe) - Math.log(p0)) / (Math.log(p1) - Math.log(p0));
            return Math.exp(Math.log(x0) + t * (Math.log(x1) - Math.log(x0)));
        }
        return x0 + (poe - p0) * (x1 - x0) / (p1 - p0);
    }
}
