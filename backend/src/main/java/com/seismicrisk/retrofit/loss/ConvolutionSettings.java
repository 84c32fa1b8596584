package com.seismicrisk.retrofit.loss;

/**
 * Numerical choices of the hazard-vulnerability convolution.
 *
 * @param binRepresentative   intensity at which each hazard bin is evaluated
 * @param lossCurveResolution loss-ratio distance below which adjacent atoms are merged
 * @param lossRatioSamples    equal-probability strata per lognormal loss distribution
 */
public record ConvolutionSettings(
        BinRepresentative binRepresentative,
        double lossCurveResolution,
        int lossRatioSamples
) {

    public static final double DEFAULT_RESOLUTION = 1e-4;
    public static final int DEFAULT_SAMPLES = 10;

    public ConvolutionSettings {
        if (binRepresentative == null) {
            binRepresentative = BinRepresentative.MIDPOINT;
        }
        if (!(lossCurveResolution >= 0.0)) {
            throw new IllegalArgumentException("Loss curve resolution must be non-negative: " + lossCurveResolution);
        }
        if (lossRatioSamples < 1) {
            throw new IllegalArgumentException("At least one loss ratio sample is required: " + lossRatioSamples);
        }
    }

    public static ConvolutionSettings defaults() {
        return new ConvolutionSettings(BinRepresentative.MIDPOINT, DEFAULT_RESOLUTION, DEFAULT_SAMPLES);
    }
}
