package com.seismicrisk.retrofit.domain.error;

import com.seismicrisk.retrofit.domain.model.FailureKind;
import lombok.Getter;

import java.util.List;

/**
 * Thrown only in strict validation mode. Lenient mode logs the same violations instead.
 */
@Getter
public class MalformedCurveException extends RiskComputationException {

    private final List<String> violations;

    public MalformedCurveException(String subject, List<String> violations) {
        super(FailureKind.MALFORMED_CURVE, subject + " is malformed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
