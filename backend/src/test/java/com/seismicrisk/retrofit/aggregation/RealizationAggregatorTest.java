package com.seismicrisk.retrofit.aggregation;

import com.seismicrisk.retrofit.domain.error.MalformedCurveException;
import com.seismicrisk.retrofit.domain.model.HazardCurve;
import com.seismicrisk.retrofit.loss.CurveValidator;
import com.seismicrisk.retrofit.loss.ValidationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for RealizationAggregator.
 *
 * Test strategy:
 * 1. Weighted mean on realizations tabulated at different levels
 * 2. Input validation (weights, site/IMT consistency)
 * 3. Weighted quantiles and individual curves
 * 4. Resource warning above the configured threshold
 */
class RealizationAggregatorTest {

    private ValidationProperties validationProperties;
    private AggregationProperties aggregationProperties;
    private RealizationAggregator aggregator;

    @BeforeEach
    void setUp() {
        validationProperties = new ValidationProperties();
        aggregationProperties = new AggregationProperties();
        aggregator = new RealizationAggregator(new CurveValidator(validationProperties), aggregationProperties);
    }

    private static HazardCurve curve(String realization, double[] levels, double[] poes) {
        return new HazardCurve("site-1", "PGA", realization, levels, poes);
    }

    @Nested
    @DisplayName("Weighted mean")
    class MeanTests {

        @Test
        @DisplayName("Should resample onto the union support before averaging")
        void shouldAverageMismatchedSupports() {
            // Given
            var a = curve("rlz-a", new double[]{0.1, 0.3}, new double[]{0.4, 0.2});
            var b = curve("rlz-b", new double[]{0.2, 0.3}, new double[]{0.3, 0.1});

            // When
            var stats = aggregator.meanOnly(List.of(a, b), Map.of("rlz-a", 0.5, "rlz-b", 0.5));

            // Then
            assertThat(stats.mean().levels()).containsExactly(0.1, 0.2, 0.3);
            assertThat(stats.mean().poes()).containsExactly(new double[]{0.35, 0.3, 0.15}, within(1e-12));
            assertThat(stats.mean().realizationId()).isEqualTo(HazardCurve.MEAN);
        }

        @Test
        @DisplayName("Should give bit-identical results for any input order")
        void shouldNotDependOnInputOrder() {
            // Given
            var a = curve("rlz-a", new double[]{0.1, 0.2, 0.4}, new double[]{0.31, 0.17, 0.013});
            var b = curve("rlz-b", new double[]{0.1, 0.2, 0.4}, new double[]{0.29, 0.11, 0.021});
            var c = curve("rlz-c", new double[]{0.1, 0.2, 0.4}, new double[]{0.37, 0.13, 0.017});
            var weights = Map.of("rlz-a", 0.2, "rlz-b", 0.7, "rlz-c", 0.1);

            // When
            var forward = aggregator.meanOnly(List.of(a, b, c), weights);
            var backward = aggregator.meanOnly(List.of(c, b, a), weights);

            // Then
            assertThat(backward.mean().poes()).isEqualTo(forward.mean().poes());
        }

        @Test
        @DisplayName("Should reject weights that do not sum to one")
        void shouldRejectBadWeights() {
            var a = curve("rlz-a", new double[]{0.1, 0.2}, new double[]{0.3, 0.1});
            var b = curve("rlz-b", new double[]{0.1, 0.2}, new double[]{0.2, 0.1});

            assertThatThrownBy(() -> aggregator.meanOnly(List.of(a, b), Map.of("rlz-a", 0.5, "rlz-b", 0.4)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("sum to");
        }

        @Test
        @DisplayName("Should reject a realization without a weight")
        void shouldRejectMissingWeight() {
            var a = curve("rlz-a", new double[]{0.1, 0.2}, new double[]{0.3, 0.1});

            assertThatThrownBy(() -> aggregator.meanOnly(List.of(a), Map.of("rlz-b", 1.0)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("rlz-a");
        }

        @Test
        @DisplayName("Should reject curves of different sites")
        void shouldRejectMixedSites() {
            var a = curve("rlz-a", new double[]{0.1, 0.2}, new double[]{0.3, 0.1});
            var b = new HazardCurve("site-2", "PGA", "rlz-b", new double[]{0.1, 0.2}, new double[]{0.3, 0.1});

            assertThatThrownBy(() -> aggregator.meanOnly(List.of(a, b), Map.of("rlz-a", 0.5, "rlz-b", 0.5)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should throw on a malformed realization in strict mode")
        void shouldRejectMalformedCurveWhenStrict() {
            validationProperties.setStrict(true);
            var rising = curve("rlz-a", new double[]{0.1, 0.2}, new double[]{0.1, 0.3});

            assertThatThrownBy(() -> aggregator.meanOnly(List.of(rising), Map.of("rlz-a", 1.0)))
                    .isInstanceOf(MalformedCurveException.class);
        }
    }

    @Nested
    @DisplayName("Quantiles and individual curves")
    class StatisticsTests {

        private final List<HazardCurve> curves = List.of(
                curve("rlz-a", new double[]{0.1}, new double[]{0.1}),
                curve("rlz-b", new double[]{0.1}, new double[]{0.2}),
                curve("rlz-c", new double[]{0.1}, new double[]{0.3}));
        private final Map<String, Double> weights = Map.of("rlz-a", 0.2, "rlz-b", 0.3, "rlz-c", 0.5);

        @Test
        @DisplayName("Should take the first value whose cumulative weight reaches the quantile")
        void shouldComputeWeightedQuantiles() {
            var stats = aggregator.aggregate(curves, weights, List.of(0.5, 0.6, 0.1), false);

            assertThat(stats.quantiles()).containsOnlyKeys(0.1, 0.5, 0.6);
            assertThat(stats.quantiles().get(0.1).poeAt(0)).isEqualTo(0.1);
            assertThat(stats.quantiles().get(0.5).poeAt(0)).isEqualTo(0.2);
            assertThat(stats.quantiles().get(0.6).poeAt(0)).isEqualTo(0.3);
            assertThat(stats.quantiles().get(0.5).realizationId()).isEqualTo("quantile-0.5");
        }

        @Test
        @DisplayName("Should return only the mean by default")
        void shouldOmitIndividualCurvesByDefault() {
            var stats = aggregator.aggregate(curves, weights, List.of(), false);

            assertThat(stats.individualCurves()).isEmpty();
            assertThat(stats.quantiles()).isEmpty();
            assertThat(stats.warnings()).isEmpty();
        }

        @Test
        @DisplayName("Should return every realization when individual curves are requested")
        void shouldReturnIndividualCurves() {
            var stats = aggregator.aggregate(curves, weights, List.of(), true);

            assertThat(stats.individualCurves())
                    .extracting(HazardCurve::realizationId)
                    .containsExactly("rlz-a", "rlz-b", "rlz-c");
        }

        @Test
        @DisplayName("Should warn when individual curves are requested above the threshold")
        void shouldWarnAboveThreshold() {
            aggregationProperties.setIndividualCurvesWarningThreshold(2);

            var withCurves = aggregator.aggregate(curves, weights, List.of(), true);
            var meanOnly = aggregator.aggregate(curves, weights, List.of(), false);

            assertThat(withCurves.warnings()).singleElement().asString().contains("3 realizations");
            assertThat(meanOnly.warnings()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a quantile outside [0, 1]")
        void shouldRejectBadQuantile() {
            assertThatThrownBy(() -> aggregator.aggregate(curves, weights, List.of(1.5), false))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
