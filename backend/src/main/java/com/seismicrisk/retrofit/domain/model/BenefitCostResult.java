package com.seismicrisk.retrofit.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Outcome of the retrofit benefit-cost analysis for one asset.
 *
 * All fields keep full double precision. Rounding happens only in {@link #format(int)}.
 * A negative benefit (retrofit increases expected loss) is a valid result.
 */
public record BenefitCostResult(
        String assetId,
        double aalOriginal,
        double aalRetrofitted,
        double annualBenefit,
        double annuityFactor,
        double discountedBenefit,
        double benefitCostRatio
) {

    public boolean isCostEffective() {
        return benefitCostRatio >= 1.0;
    }

    public String format(int precision) {
        return String.format("asset=%s, aalOriginal=%s, aalRetrofitted=%s, discountedBenefit=%s, bcr=%s",
                assetId,
                round(aalOriginal, precision),
                round(aalRetrofitted, precision),
                round(discountedBenefit, precision),
                round(benefitCostRatio, precision));
    }

    private static String round(double value, int precision) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).toPlainString();
    }
}
