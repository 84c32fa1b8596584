package com.seismicrisk.retrofit.hazard;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Classification of every job parameter as hazard-affecting or downstream-only.
 *
 * Adding a field to {@link JobConfiguration} without an entry here is caught by
 * CacheKeyFactoryTest: an unclassified field would silently be left out of the key.
 */
public enum JobParameter {

    CALCULATION_MODE("calculation_mode", "calculationMode", ParameterScope.HAZARD, JobConfiguration::getCalculationMode),
    SOURCE_MODEL("source_model_logic_tree", "sourceModel", ParameterScope.HAZARD, JobConfiguration::getSourceModel),
    GMPE_LOGIC_TREE("gsim_logic_tree", "gmpeLogicTree", ParameterScope.HAZARD, JobConfiguration::getGmpeLogicTree),
    SITES("sites", "sites", ParameterScope.HAZARD, JobConfiguration::getSites),
    INTENSITY_MEASURE_LEVELS("intensity_measure_types_and_levels", "intensityMeasureLevels", ParameterScope.HAZARD,
            JobConfiguration::getIntensityMeasureLevels),
    TRUNCATION_LEVEL("truncation_level", "truncationLevel", ParameterScope.HAZARD, JobConfiguration::getTruncationLevel),
    MAXIMUM_DISTANCE("maximum_distance", "maximumDistance", ParameterScope.HAZARD, JobConfiguration::getMaximumDistance),
    INVESTIGATION_TIME("investigation_time", "investigationTime", ParameterScope.HAZARD,
            JobConfiguration::getInvestigationTime),
    NUMBER_OF_LOGIC_TREE_SAMPLES("number_of_logic_tree_samples", "numberOfLogicTreeSamples", ParameterScope.HAZARD,
            JobConfiguration::getNumberOfLogicTreeSamples),
    RANDOM_SEED("random_seed", "randomSeed", ParameterScope.HAZARD, JobConfiguration::getRandomSeed),
    REFERENCE_VS30("reference_vs30_value", "referenceVs30", ParameterScope.HAZARD, JobConfiguration::getReferenceVs30),

    HAZARD_MAP_POES("poes", "hazardMapPoes", ParameterScope.DOWNSTREAM, JobConfiguration::getHazardMapPoes),
    INDIVIDUAL_CURVES("individual_curves", "individualCurves", ParameterScope.DOWNSTREAM,
            JobConfiguration::isIndividualCurves),
    QUANTILES("quantiles", "quantiles", ParameterScope.DOWNSTREAM, JobConfiguration::getQuantiles),
    EXPORT_FORMATS("export_type", "exportFormats", ParameterScope.DOWNSTREAM, JobConfiguration::getExportFormats),
    ORIGINAL_VULNERABILITY_MODEL("vulnerability_file", "originalVulnerabilityModel", ParameterScope.DOWNSTREAM,
            JobConfiguration::getOriginalVulnerabilityModel),
    RETROFITTED_VULNERABILITY_MODEL("vulnerability_retrofitted_file", "retrofittedVulnerabilityModel",
            ParameterScope.DOWNSTREAM, JobConfiguration::getRetrofittedVulnerabilityModel),
    INTEREST_RATE("interest_rate", "interestRate", ParameterScope.DOWNSTREAM, JobConfiguration::getInterestRate),
    LIFE_EXPECTANCY("asset_life_expectancy", "lifeExpectancy", ParameterScope.DOWNSTREAM,
            JobConfiguration::getLifeExpectancy),
    LOSS_CURVE_RESOLUTION("loss_curve_resolution", "lossCurveResolution", ParameterScope.DOWNSTREAM,
            JobConfiguration::getLossCurveResolution),
    BIN_REPRESENTATIVE("bin_representative_intensity", "binRepresentative", ParameterScope.DOWNSTREAM,
            JobConfiguration::getBinRepresentative),
    LOSS_RATIO_SAMPLES("loss_ratio_samples", "lossRatioSamples", ParameterScope.DOWNSTREAM,
            JobConfiguration::getLossRatioSamples),
    CONDITIONAL_LOSS_POES("conditional_loss_poes", "conditionalLossPoes", ParameterScope.DOWNSTREAM,
            JobConfiguration::getConditionalLossPoes);

    private final String key;
    private final String fieldName;
    private final ParameterScope scope;
    private final Function<JobConfiguration, Object> extractor;

    JobParameter(String key, String fieldName, ParameterScope scope, Function<JobConfiguration, Object> extractor) {
        this.key = key;
        this.fieldName = fieldName;
        this.scope = scope;
        this.extractor = extractor;
    }

    public String key() {
        return key;
    }

    public String fieldName() {
        return fieldName;
    }

    public ParameterScope scope() {
        return scope;
    }

    public boolean affectsHazard() {
        return scope == ParameterScope.HAZARD;
    }

    public Object extract(JobConfiguration configuration) {
        return extractor.apply(configuration);
    }

    public static List<JobParameter> hazardParameters() {
        return Arrays.stream(values()).filter(JobParameter::affectsHazard).toList();
    }
}
