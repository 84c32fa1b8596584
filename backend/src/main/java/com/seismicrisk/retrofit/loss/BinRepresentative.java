package com.seismicrisk.retrofit.loss;

/**
 * Intensity at which the loss distribution of a hazard bin [x_i, x_i+1) is evaluated.
 */
public enum BinRepresentative {
    LEFT_EDGE,
    MIDPOINT,
    RIGHT_EDGE;

    public double pick(double lower, double upper) {
        return switch (this) {
            case LEFT_EDGE -> lower;
            case MIDPOINT -> (lower + upper) / 2.0;
            case RIGHT_EDGE -> upper;
        };
    }
}
