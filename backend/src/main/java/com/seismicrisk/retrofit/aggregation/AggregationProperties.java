package com.seismicrisk.retrofit.aggregation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "aggregation")
public class AggregationProperties {

    /**
     * Realization count above which requesting individual curves raises a resource warning.
     */
    private int individualCurvesWarningThreshold = 100;

    /**
     * Allowed deviation of the realization weights from a sum of 1.
     */
    private double weightTolerance = 1e-6;
}
