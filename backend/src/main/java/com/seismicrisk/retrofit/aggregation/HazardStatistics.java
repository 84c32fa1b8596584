package com.seismicrisk.retrofit.aggregation;

import com.seismicrisk.retrofit.domain.model.HazardCurve;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Statistics of the realizations of one (site, IMT) group.
 *
 * @param quantiles        quantile curves keyed by quantile, in ascending order
 * @param individualCurves per-realization curves on the common support; empty unless requested
 * @param warnings         resource-risk warnings raised while aggregating
 */
public record HazardStatistics(
        String siteId,
        String intensityMeasureType,
        HazardCurve mean,
        Map<Double, HazardCurve> quantiles,
        List<HazardCurve> individualCurves,
        List<String> warnings
) {

    public HazardStatistics {
        quantiles = Collections.unmodifiableMap(new TreeMap<>(quantiles));
        individualCurves = List.copyOf(individualCurves);
        warnings = List.copyOf(warnings);
    }
}
