package com.seismicrisk.retrofit.economics;

import com.seismicrisk.retrofit.domain.error.InvalidEconomicsException;
import com.seismicrisk.retrofit.domain.model.AverageAnnualLoss;
import com.seismicrisk.retrofit.domain.model.LossUnit;
import com.seismicrisk.retrofit.domain.model.RetrofitEconomics;
import com.seismicrisk.retrofit.domain.model.VulnerabilityVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.seismicrisk.retrofit.RetrofitFixtures.ANNUITY_FACTOR;
import static com.seismicrisk.retrofit.RetrofitFixtures.EXPECTED_BCR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for BenefitCostCalculator.
 *
 * Test strategy:
 * 1. Annuity factor, including the zero-rate limit and its bounds
 * 2. The reference scenario BCR
 * 3. Zero and negative benefits, rejected inputs
 */
class BenefitCostCalculatorTest {

    private BenefitCostCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new BenefitCostCalculator(new EconomicsProperties());
    }

    private static AverageAnnualLoss aal(VulnerabilityVariant variant, double value) {
        return new AverageAnnualLoss("asset-1", variant, value, LossUnit.MONETARY);
    }

    @Nested
    @DisplayName("Annuity factor")
    class AnnuityFactorTests {

        @Test
        @DisplayName("Should discount 25 years at 5%")
        void shouldDiscountAtFivePercent() {
            assertThat(calculator.annuityFactor(0.05, 25)).isCloseTo(ANNUITY_FACTOR, within(1e-12));
        }

        @Test
        @DisplayName("Should equal the number of years at a zero rate")
        void shouldUseLifeAtZeroRate() {
            assertThat(calculator.annuityFactor(0.0, 30)).isEqualTo(30.0);
        }

        @ParameterizedTest(name = "rate={0}, life={1}")
        @CsvSource({
                "0.01, 1",
                "0.05, 25",
                "0.05, 50",
                "0.10, 10",
                "0.30, 100"
        })
        @DisplayName("Should lie strictly between zero and the number of years for a positive rate")
        void shouldBeBoundedByLife(double rate, int life) {
            double factor = calculator.annuityFactor(rate, life);

            assertThat(factor).isGreaterThan(0.0).isLessThan(life);
        }

        @Test
        @DisplayName("Should approach the number of years as the rate goes to zero")
        void shouldBeContinuousNearZero() {
            assertThat(calculator.annuityFactor(1e-12, 30)).isCloseTo(30.0, within(1e-6));
        }
    }

    @Nested
    @DisplayName("Benefit-cost ratio")
    class RatioTests {

        @Test
        @DisplayName("Should compute the reference BCR")
        void shouldComputeReferenceRatio() {
            // Given
            var economics = new RetrofitEconomics("asset-1", 0.05, 25, 1000.0);

            // When
            var result = calculator.calculate(aal(VulnerabilityVariant.ORIGINAL, 880.0),
                    aal(VulnerabilityVariant.RETROFITTED, 460.0), economics);

            // Then
            assertThat(result.annualBenefit()).isCloseTo(420.0, within(1e-9));
            assertThat(result.discountedBenefit()).isCloseTo(5919.456717738798, within(1e-6));
            assertThat(result.benefitCostRatio()).isCloseTo(EXPECTED_BCR, within(1e-9));
            assertThat(result.isCostEffective()).isTrue();
            assertThat(calculator.render(result)).contains("bcr=5.9195").contains("aalOriginal=880.0000");
        }

        @Test
        @DisplayName("Should report a negative ratio when the retrofit raises expected loss")
        void shouldReportNegativeBenefit() {
            var economics = new RetrofitEconomics("asset-1", 0.05, 25, 1000.0);

            var result = calculator.calculate(aal(VulnerabilityVariant.ORIGINAL, 400.0),
                    aal(VulnerabilityVariant.RETROFITTED, 500.0), economics);

            assertThat(result.annualBenefit()).isEqualTo(-100.0);
            assertThat(result.benefitCostRatio()).isNegative();
            assertThat(result.isCostEffective()).isFalse();
        }

        @Test
        @DisplayName("Should give a zero ratio, not an error, when the retrofit leaves expected loss unchanged")
        void shouldGiveZeroForUnchangedLoss() {
            var economics = new RetrofitEconomics("asset-1", 0.05, 25, 1000.0);

            var result = calculator.calculate(aal(VulnerabilityVariant.ORIGINAL, 880.0),
                    aal(VulnerabilityVariant.RETROFITTED, 880.0), economics);

            assertThat(result.annualBenefit()).isEqualTo(0.0);
            assertThat(result.discountedBenefit()).isEqualTo(0.0);
            assertThat(result.benefitCostRatio()).isEqualTo(0.0);
            assertThat(result.isCostEffective()).isFalse();
        }

        @Test
        @DisplayName("Should reject AALs in different units")
        void shouldRejectMixedUnits() {
            var economics = new RetrofitEconomics("asset-1", 0.05, 25, 1000.0);
            var ratio = new AverageAnnualLoss("asset-1", VulnerabilityVariant.RETROFITTED, 0.046, LossUnit.LOSS_RATIO);

            assertThatThrownBy(() -> calculator.calculate(aal(VulnerabilityVariant.ORIGINAL, 880.0), ratio, economics))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @ParameterizedTest(name = "rate={0}, life={1}, cost={2} -> {3}")
    @CsvSource({
            "-0.01, 25, 1000, interestRate",
            "NaN,   25, 1000, interestRate",
            "0.05,  0,  1000, lifeExpectancy",
            "0.05,  25, 0,    retrofitCost",
            "0.05,  25, -5,   retrofitCost"
    })
    @DisplayName("Should name the invalid economic parameter")
    void shouldRejectInvalidEconomics(double rate, int life, double cost, String parameter) {
        var economics = new RetrofitEconomics("asset-1", rate, life, cost);

        assertThatThrownBy(() -> calculator.calculate(aal(VulnerabilityVariant.ORIGINAL, 880.0),
                aal(VulnerabilityVariant.RETROFITTED, 460.0), economics))
                .isInstanceOfSatisfying(InvalidEconomicsException.class,
                        e -> assertThat(e.getParameter()).isEqualTo(parameter));
    }
}
