package com.seismicrisk.retrofit.domain.error;

import com.seismicrisk.retrofit.domain.model.FailureKind;
import lombok.Getter;

@Getter
public class IncompatibleIntensityMeasureException extends RiskComputationException {

    private final String hazardImt;
    private final String vulnerabilityImt;

    public IncompatibleIntensityMeasureException(String hazardImt, String vulnerabilityImt) {
        super(FailureKind.INCOMPATIBLE_INTENSITY_MEASURE, String.format(
                "Hazard curve is in %s but vulnerability function expects %s", hazardImt, vulnerabilityImt));
        this.hazardImt = hazardImt;
        this.vulnerabilityImt = vulnerabilityImt;
    }
}
