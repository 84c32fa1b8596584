package com.seismicrisk.retrofit.aggregation;

import com.seismicrisk.retrofit.domain.model.HazardCurve;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HazardMapExtractorTest {

    private final HazardMapExtractor extractor = new HazardMapExtractor();

    private final HazardCurve curve = new HazardCurve("site-1", "PGA", HazardCurve.MEAN,
            new double[]{0.1, 0.2, 0.4}, new double[]{0.1, 0.01, 0.001});

    @Test
    @DisplayName("Interpolates log-log between bracketing points")
    void interpolatesLogLog() {
        double target = Math.sqrt(0.1 * 0.01);

        assertThat(extractor.intensityAt(curve, target)).isCloseTo(Math.sqrt(0.1 * 0.2), within(1e-12));
        assertThat(extractor.intensityAt(curve, 0.01)).isCloseTo(0.2, within(1e-12));
    }

    @Test
    @DisplayName("Clamps targets outside the curve to the first and last level")
    void clampsOutOfRangeTargets() {
        assertThat(extractor.intensityAt(curve, 0.5)).isEqualTo(0.1);
        assertThat(extractor.intensityAt(curve, 0.0005)).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Falls back to linear interpolation next to a zero probability")
    void interpolatesLinearlyNearZero() {
        var truncated = new HazardCurve("site-1", "PGA", HazardCurve.MEAN,
                new double[]{0.1, 0.2}, new double[]{0.1, 0.0});

        assertThat(extractor.intensityAt(truncated, 0.05)).isCloseTo(0.15, within(1e-12));
    }

    @Test
    @DisplayName("Keeps the order of the requested probabilities")
    void keepsTargetOrder() {
        var map = extractor.extract(curve, List.of(0.01, 0.1));

        assertThat(map.keySet()).containsExactly(0.01, 0.1);
    }
}
