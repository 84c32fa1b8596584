package com.seismicrisk.retrofit.domain.error;

import com.seismicrisk.retrofit.domain.model.FailureKind;

public class MissingInputException extends RiskComputationException {

    public MissingInputException(String message) {
        super(FailureKind.MISSING_INPUT, message);
    }
}
