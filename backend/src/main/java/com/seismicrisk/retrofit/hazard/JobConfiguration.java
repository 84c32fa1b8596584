package com.seismicrisk.retrofit.hazard;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.seismicrisk.retrofit.domain.model.Site;
import com.seismicrisk.retrofit.loss.BinRepresentative;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Typed parameters of one calculation job.
 *
 * Every field is classified by a {@link JobParameter}; only HAZARD-scoped fields take
 * part in the cache key, so a rerun that changes only DOWNSTREAM fields reuses the
 * stored hazard curves.
 *
 * An explicit JSON null for a list or map field binds as empty.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class JobConfiguration {

    // Hazard-affecting

    @Builder.Default
    String calculationMode = "classical";

    String sourceModel;

    String gmpeLogicTree;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    List<Site> sites = List.of();

    /**
     * Intensity levels per intensity-measure type, e.g. "PGA" -> [0.1, 0.2, 0.4].
     */
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    Map<String, List<Double>> intensityMeasureLevels = Map.of();

    @Builder.Default
    double truncationLevel = 3.0;

    @Builder.Default
    double maximumDistance = 200.0;

    @Builder.Default
    double investigationTime = 1.0;

    /**
     * Zero means full logic-tree enumeration.
     */
    @Builder.Default
    int numberOfLogicTreeSamples = 0;

    @Builder.Default
    long randomSeed = 42L;

    @Builder.Default
    double referenceVs30 = 760.0;

    // Downstream only

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    List<Double> hazardMapPoes = List.of();

    @Builder.Default
    boolean individualCurves = false;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    List<Double> quantiles = List.of();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    List<String> exportFormats = List.of("json");

    String originalVulnerabilityModel;

    String retrofittedVulnerabilityModel;

    @Builder.Default
    double interestRate = 0.05;

    @Builder.Default
    int lifeExpectancy = 50;

    @Builder.Default
    double lossCurveResolution = 1e-4;

    @Builder.Default
    BinRepresentative binRepresentative = BinRepresentative.MIDPOINT;

    @Builder.Default
    int lossRatioSamples = 10;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    List<Double> conditionalLossPoes = List.of();
}
