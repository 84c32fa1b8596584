package com.seismicrisk.retrofit.domain.error;

import com.seismicrisk.retrofit.domain.model.FailureKind;

public class DegenerateCurveException extends RiskComputationException {

    public DegenerateCurveException(String message) {
        super(FailureKind.DEGENERATE_CURVE, message);
    }
}
