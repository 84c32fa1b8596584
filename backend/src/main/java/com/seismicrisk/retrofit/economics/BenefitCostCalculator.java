package com.seismicrisk.retrofit.economics;

import com.seismicrisk.retrofit.domain.error.InvalidEconomicsException;
import com.seismicrisk.retrofit.domain.model.AverageAnnualLoss;
import com.seismicrisk.retrofit.domain.model.BenefitCostResult;
import com.seismicrisk.retrofit.domain.model.RetrofitEconomics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Discounted benefit-cost analysis of a retrofit.
 *
 * The retrofit pays for itself through the yearly reduction in expected loss,
 * received every year of the structure's remaining life and discounted at the
 * interest rate:
 *
 *   annuity factor    = (1 - (1 + r)^-n) / r, or n when r = 0
 *   discounted benefit = (AAL_original - AAL_retrofitted) * annuity factor
 *   BCR               = discounted benefit / retrofit cost
 *
 * A BCR above 1 means the retrofit is cost-effective. A negative benefit is reported
 * as is.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BenefitCostCalculator {

    private final EconomicsProperties properties;

    public BenefitCostResult calculate(AverageAnnualLoss original,
                                       AverageAnnualLoss retrofitted,
                                       RetrofitEconomics economics) {
        validate(economics);
        if (original.unit() != retrofitted.unit()) {
            throw new IllegalArgumentException(String.format(
                    "AALs of asset %s are in different units: %s and %s",
                    economics.assetId(), original.unit(), retrofitted.unit()));
        }

        double annualBenefit = original.value() - retrofitted.value();
        double annuityFactor = annuityFactor(economics.interestRate(), economics.lifeExpectancy());
        double discountedBenefit = annualBenefit * annuityFactor;
        double bcr = discountedBenefit / economics.retrofitCost();

        BenefitCostResult result = new BenefitCostResult(economics.assetId(),
                original.value(), retrofitted.value(), annualBenefit, annuityFactor, discountedBenefit, bcr);
        if (log.isDebugEnabled()) {
            log.debug("Benefit-cost: {}", result.format(properties.getDisplayPrecision()));
        }
        return result;
    }

    /**
     * Present value of 1 per year for n years at rate r. Uses expm1/log1p so that very
     * small rates lose no precision.
     */
    public double annuityFactor(double interestRate, int lifeExpectancy) {
        validateRate(interestRate);
        validateLife(lifeExpectancy);
        if (interestRate == 0.0) {
            return lifeExpectancy;
        }
        return -Math.expm1(-lifeExpectancy * Math.log1p(interestRate)) / interestRate;
    }

    public String render(BenefitCostResult result) {
        return result.format(properties.getDisplayPrecision());
    }

    private static void validate(RetrofitEconomics economics) {
        validateRate(economics.interestRate());
        validateLife(economics.lifeExpectancy());
        double cost = economics.retrofitCost();
        if (!Double.isFinite(cost) || cost <= 0.0) {
            throw new InvalidEconomicsException("retrofitCost", "must be a positive finite amount, was " + cost);
        }
    }

    private static void validateRate(double interestRate) {
        if (!Double.isFinite(interestRate) || interestRate < 0.0) {
            throw new InvalidEconomicsException("interestRate", "must be a finite rate >= 0, was " + interestRate);
        }
    }

    private static void validateLife(int lifeExpectancy) {
        if (lifeExpectancy <= 0) {
            throw new InvalidEconomicsException("lifeExpectancy", "must be a positive number of years, was " + lifeExpectancy);
        }
    }
}
