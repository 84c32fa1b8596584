package com.seismicrisk.retrofit.loss;

import com.seismicrisk.retrofit.domain.error.DegenerateCurveException;
import com.seismicrisk.retrofit.domain.model.AverageAnnualLoss;
import com.seismicrisk.retrofit.domain.model.LossExceedanceCurve;
import com.seismicrisk.retrofit.domain.model.VulnerabilityVariant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Integrates a loss-exceedance curve into an average annual loss.
 *
 * INTEGRATION POLICY:
 * - Left-Riemann sum over the curve's own points:
 *   AAL = E_0 * L_0 + sum over k of E_k-1 * (L_k - L_k-1)
 * - Below the smallest tabulated loss the exceedance probability is taken to be
 *   constant at E_0 (the E_0 * L_0 term); it is not extrapolated to 1
 * - Nothing is added above the largest tabulated loss
 *
 * For curves whose PoE is the probability of strictly exceeding each support point,
 * as produced by {@link VulnerabilityConvolutionEngine}, this sum is exactly the
 * expected loss. Both vulnerability variants go through the same policy.
 */
@Component
@RequiredArgsConstructor
public class LossIntegrator {

    private final CurveValidator curveValidator;

    public double integrate(LossExceedanceCurve curve) {
        if (curve.size() < 2) {
            throw new DegenerateCurveException(String.format(
                    "Loss curve of asset %s has %d point(s), at least 2 are needed", curve.assetId(), curve.size()));
        }
        curveValidator.validate(curve);

        double aal = curve.poeAt(0) * curve.lossAt(0);
        for (int k = 1; k < curve.size(); k++) {
            aal += curve.poeAt(k - 1) * (curve.lossAt(k) - curve.lossAt(k - 1));
        }
        return aal;
    }

    public AverageAnnualLoss averageAnnualLoss(LossExceedanceCurve curve, VulnerabilityVariant variant) {
        return new AverageAnnualLoss(curve.assetId(), variant, integrate(curve), curve.unit());
    }
}
