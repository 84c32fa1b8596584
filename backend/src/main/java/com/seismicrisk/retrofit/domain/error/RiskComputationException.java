package com.seismicrisk.retrofit.domain.error;

import com.seismicrisk.retrofit.domain.model.FailureKind;
import lombok.Getter;

/**
 * Base class for failures that affect a single asset and never abort a batch.
 */
@Getter
public class RiskComputationException extends RuntimeException {

    private final FailureKind kind;

    public RiskComputationException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RiskComputationException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
