package com.seismicrisk.retrofit.loss;

import com.seismicrisk.retrofit.domain.error.MalformedCurveException;
import com.seismicrisk.retrofit.domain.model.HazardCurve;
import com.seismicrisk.retrofit.domain.model.LossExceedanceCurve;
import com.seismicrisk.retrofit.domain.model.VulnerabilityFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Range and monotonicity checks for curves entering the loss pipeline.
 *
 * LENIENT (default): violations are logged at WARN and returned; the pipeline goes on
 * with the data as given.
 * STRICT: the first malformed input raises {@link MalformedCurveException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CurveValidator {

    private final ValidationProperties properties;

    public List<String> validate(HazardCurve curve) {
        return check("Hazard curve " + curve.siteId() + "/" + curve.intensityMeasureType() + "/" + curve.realizationId(),
                curve.monotonicityViolations());
    }

    public List<String> validate(VulnerabilityFunction function) {
        return check("Vulnerability function " + function.taxonomy(), function.lossRatioViolations());
    }

    public List<String> validate(LossExceedanceCurve curve) {
        return check("Loss curve of asset " + curve.assetId(), curve.monotonicityViolations());
    }

    public boolean isStrict() {
        return properties.isStrict();
    }

    private List<String> check(String subject, List<String> violations) {
        if (violations.isEmpty()) {
            return violations;
        }
        if (properties.isStrict()) {
            throw new MalformedCurveException(subject, violations);
        }
        log.warn("{} is malformed, continuing in lenient mode: {}", subject, violations);
        return violations;
    }
}
