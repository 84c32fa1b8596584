package com.seismicrisk.retrofit.domain.error;

import com.seismicrisk.retrofit.domain.model.FailureKind;
import lombok.Getter;

/**
 * Raised when an economic input is out of range. {@link #getParameter()} names the
 * offending input: interestRate, lifeExpectancy or retrofitCost.
 */
@Getter
public class InvalidEconomicsException extends RiskComputationException {

    private final String parameter;

    public InvalidEconomicsException(String parameter, String message) {
        super(FailureKind.INVALID_ECONOMICS, parameter + ": " + message);
        this.parameter = parameter;
    }
}
