package com.seismicrisk.retrofit.hazard;

import com.seismicrisk.retrofit.domain.model.HazardCurve;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HazardCurveStoreTest {

    private static final CacheKey KEY = CacheKey.of("0f".repeat(32));

    private static HazardCurve curve(String site, String imt, String rlz, double poe) {
        return new HazardCurve(site, imt, rlz, new double[]{0.1, 0.2}, new double[]{poe, poe / 2});
    }

    @Test
    @DisplayName("Indexes curves by site and IMT, ordered by realization")
    void indexesCurves() {
        var store = HazardCurveStore.builder(KEY)
                .weight("rlz-001", 0.4)
                .weight("rlz-000", 0.6)
                .curve(curve("site-1", "SA(0.3)", "rlz-001", 0.2))
                .curve(curve("site-1", "PGA", "rlz-001", 0.3))
                .curve(curve("site-1", "PGA", "rlz-000", 0.4))
                .build();

        assertThat(store.siteIds()).containsExactly("site-1");
        assertThat(store.intensityMeasureTypes("site-1")).containsExactly("PGA", "SA(0.3)");
        assertThat(store.curves("site-1", "PGA")).extracting(HazardCurve::realizationId)
                .containsExactly("rlz-000", "rlz-001");
        assertThat(store.curves("site-2", "PGA")).isEmpty();
        assertThat(store.curveCount()).isEqualTo(3);
        assertThat(store.realizationCount()).isEqualTo(2);
        assertThat(store.verifyIntegrity()).isTrue();
    }

    @Test
    @DisplayName("Gives the same checksum regardless of insertion order")
    void checksumIgnoresInsertionOrder() {
        var a = curve("site-1", "PGA", "rlz-000", 0.4);
        var b = curve("site-2", "PGA", "rlz-000", 0.3);

        var forward = HazardCurveStore.builder(KEY).weight("rlz-000", 1.0).curves(List.of(a, b)).build();
        var reverse = HazardCurveStore.builder(KEY).weight("rlz-000", 1.0).curves(List.of(b, a)).build();

        assertThat(forward.checksum()).isEqualTo(reverse.checksum()).hasSize(64);
    }

    @Test
    @DisplayName("Rejects two curves for the same realization")
    void rejectsDuplicateRealization() {
        var builder = HazardCurveStore.builder(KEY)
                .weight("rlz-000", 1.0)
                .curve(curve("site-1", "PGA", "rlz-000", 0.4))
                .curve(curve("site-1", "PGA", "rlz-000", 0.3));

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate curve");
    }

    @Test
    @DisplayName("Fails the integrity check when a curve has no realization weight")
    void detectsUnweightedCurves() {
        var store = HazardCurveStore.builder(KEY)
                .weight("rlz-000", 1.0)
                .curve(curve("site-1", "PGA", "rlz-009", 0.4))
                .build();

        assertThat(store.verifyIntegrity()).isFalse();
    }
}
