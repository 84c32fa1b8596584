package com.seismicrisk.retrofit.hazard;

import com.seismicrisk.retrofit.domain.model.Site;
import com.seismicrisk.retrofit.loss.BinRepresentative;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.seismicrisk.retrofit.RetrofitFixtures.referenceConfiguration;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CacheKeyFactory.
 *
 * Test strategy:
 * 1. Every configuration field is classified as hazard or downstream
 * 2. Each hazard parameter changes the key, downstream parameters never do
 * 3. Ordering of sites and IMTs does not matter
 */
class CacheKeyFactoryTest {

    private HazardCacheProperties properties;
    private CacheKeyFactory factory;

    @BeforeEach
    void setUp() {
        properties = new HazardCacheProperties();
        factory = new CacheKeyFactory(properties);
    }

    @Test
    @DisplayName("Every JobConfiguration field is classified by exactly one JobParameter")
    void everyFieldIsClassified() {
        var fields = Arrays.stream(JobConfiguration.class.getDeclaredFields())
                .filter(field -> !Modifier.isStatic(field.getModifiers()) && !field.isSynthetic())
                .map(Field::getName)
                .collect(Collectors.toSet());
        var classified = Arrays.stream(JobParameter.values())
                .map(JobParameter::fieldName)
                .toList();

        assertThat(classified).doesNotHaveDuplicates();
        assertThat(classified).containsExactlyInAnyOrderElementsOf(fields);
    }

    @Test
    @DisplayName("Same configuration gives the same 64-character key from separate factories")
    void isDeterministic() {
        var first = factory.keyFor(referenceConfiguration());
        var second = new CacheKeyFactory(new HazardCacheProperties()).keyFor(referenceConfiguration());

        assertThat(first).isEqualTo(second);
        assertThat(first.value()).hasSize(64);
    }

    @Test
    @DisplayName("Canonical form lists only hazard parameters and the schema version")
    void canonicalFormHoldsHazardParametersOnly() {
        String canonical = factory.canonicalJson(referenceConfiguration());

        assertThat(canonical).contains("\"source_model_logic_tree\"", "\"gsim_logic_tree\"",
                "\"" + CacheKeyFactory.SCHEMA_VERSION_KEY + "\":1");
        assertThat(canonical).doesNotContain("interest_rate", "vulnerability_file", "individual_curves");
    }

    @Test
    @DisplayName("Bumping the key schema version changes every key")
    void schemaVersionChangesKey() {
        var before = factory.keyFor(referenceConfiguration());

        properties.setKeySchemaVersion(2);

        assertThat(factory.keyFor(referenceConfiguration())).isNotEqualTo(before);
    }


    static Stream<Arguments> hazardChanges() {
        return Stream.of(
                Arguments.of("calculation_mode", change(b -> b.calculationMode("event_based"))),
                Arguments.of("source_model_logic_tree", change(b -> b.sourceModel("area-source-model-v2"))),
                Arguments.of("gsim_logic_tree", change(b -> b.gmpeLogicTree("gmpe-tree-v2"))),
                Arguments.of("sites", change(b -> b.sites(List.of(new Site("site-2", 13.0, 42.0))))),
                Arguments.of("intensity_measure_types_and_levels",
                        change(b -> b.intensityMeasureLevels(Map.of("PGA", List.of(0.1, 0.3, 0.6))))),
                Arguments.of("truncation_level", change(b -> b.truncationLevel(2.0))),
                Arguments.of("maximum_distance", change(b -> b.maximumDistance(300.0))),
                Arguments.of("investigation_time", change(b -> b.investigationTime(50.0))),
                Arguments.of("number_of_logic_tree_samples", change(b -> b.numberOfLogicTreeSamples(10))),
                Arguments.of("random_seed", change(b -> b.randomSeed(7L))),
                Arguments.of("reference_vs30_value", change(b -> b.referenceVs30(400.0)))
        );
    }

    static Stream<Arguments> downstreamChanges() {
        return Stream.of(
                Arguments.of("poes", change(b -> b.hazardMapPoes(List.of(0.1, 0.02)))),
                Arguments.of("individual_curves", change(b -> b.individualCurves(true))),
                Arguments.of("quantiles", change(b -> b.quantiles(List.of(0.15, 0.85)))),
                Arguments.of("export_type", change(b -> b.exportFormats(List.of("csv")))),
                Arguments.of("vulnerability_file", change(b -> b.originalVulnerabilityModel("other"))),
                Arguments.of("vulnerability_retrofitted_file",
                        change(b -> b.retrofittedVulnerabilityModel("other"))),
                Arguments.of("interest_rate", change(b -> b.interestRate(0.03))),
                Arguments.of("asset_life_expectancy", change(b -> b.lifeExpectancy(10))),
                Arguments.of("loss_curve_resolution", change(b -> b.lossCurveResolution(0.01))),
                Arguments.of("bin_representative_intensity",
                        change(b -> b.binRepresentative(BinRepresentative.LEFT_EDGE))),
                Arguments.of("loss_ratio_samples", change(b -> b.lossRatioSamples(50))),
                Arguments.of("conditional_loss_poes", change(b -> b.conditionalLossPoes(List.of(0.01))))
        );
    }

    private static UnaryOperator<JobConfiguration.JobConfigurationBuilder> change(
            UnaryOperator<JobConfiguration.JobConfigurationBuilder> modification) {
        return modification;
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("hazardChanges")
    @DisplayName("Changing a hazard parameter changes the key")
    void hazardParameterChangesKey(String parameter, UnaryOperator<JobConfiguration.JobConfigurationBuilder> modification) {
        var base = referenceConfiguration();
        var changed = modification.apply(base.toBuilder()).build();

        assertThat(factory.keyFor(changed)).isNotEqualTo(factory.keyFor(base));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("downstreamChanges")
    @DisplayName("Changing a downstream parameter keeps the key")
    void downstreamParameterKeepsKey(String parameter, UnaryOperator<JobConfiguration.JobConfigurationBuilder> modification) {
        var base = referenceConfiguration();
        var changed = modification.apply(base.toBuilder()).build();

        assertThat(factory.keyFor(changed)).isEqualTo(factory.keyFor(base));
    }

    @Test
    @DisplayName("Test cases cover every parameter")
    void casesCoverEveryParameter() {
        var covered = Stream.concat(hazardChanges(), downstreamChanges())
                .map(arguments -> (String) arguments.get()[0])
                .toList();

        assertThat(covered).containsExactlyInAnyOrderElementsOf(
                Arrays.stream(JobParameter.values()).map(JobParameter::key).toList());
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Site order does not affect the key")
        void siteOrderIsIrrelevant() {
            var a = new Site("site-a", 12.0, 41.0);
            var b = new Site("site-b", 13.0, 42.0);
            var base = referenceConfiguration();

            var forward = base.toBuilder().sites(List.of(a, b)).build();
            var reverse = base.toBuilder().sites(List.of(b, a)).build();

            assertThat(factory.keyFor(forward)).isEqualTo(factory.keyFor(reverse));
        }

        @Test
        @DisplayName("IMT order does not affect the key")
        void imtOrderIsIrrelevant() {
            Map<String, List<Double>> pgaFirst = new LinkedHashMap<>();
            pgaFirst.put("PGA", List.of(0.1, 0.3));
            pgaFirst.put("SA(0.3)", List.of(0.2, 0.4));
            Map<String, List<Double>> saFirst = new LinkedHashMap<>();
            saFirst.put("SA(0.3)", List.of(0.2, 0.4));
            saFirst.put("PGA", List.of(0.1, 0.3));
            var base = referenceConfiguration();

            assertThat(factory.keyFor(base.toBuilder().intensityMeasureLevels(pgaFirst).build()))
                    .isEqualTo(factory.keyFor(base.toBuilder().intensityMeasureLevels(saFirst).build()));
        }
    }
}
