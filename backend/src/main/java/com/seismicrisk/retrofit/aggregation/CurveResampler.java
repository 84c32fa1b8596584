package com.seismicrisk.retrofit.aggregation;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.TreeSet;
import java.util.function.DoubleUnaryOperator;

/**
 * Interpolation of tabulated curves onto a common support.
 *
 * Linear between tabulated points, which keeps a monotone curve monotone, and held
 * flat at the nearest endpoint outside the tabulated range. All methods are pure.
 */
public final class CurveResampler {

    private CurveResampler() {
    }

    /**
     * Sorted union of the given supports, without duplicates.
     */
    public static double[] unionSupport(double[]... supports) {
        TreeSet<Double> union = new TreeSet<>();
        for (double[] support : supports) {
            for (double x : support) {
                union.add(x);
            }
        }
        return union.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Support of a curve combined with another table: every level of {@code curve},
     * plus the levels of {@code other} that fall inside the curve's range.
     * Levels of {@code other} beyond the curve's ends are dropped.
     */
    public static double[] commonSupport(double[] curve, double[] other) {
        if (curve.length == 0) {
            return new double[0];
        }
        double low = curve[0];
        double high = curve[curve.length - 1];
        TreeSet<Double> support = new TreeSet<>();
        for (double x : curve) {
            support.add(x);
        }
        for (double x : other) {
            if (x >= low && x <= high) {
                support.add(x);
            }
        }
        return support.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Values of the curve (xs, ys) at each of targetXs.
     *
     * @param xs strictly increasing abscissae
     */
    public static double[] resample(double[] xs, double[] ys, double[] targetXs) {
        DoubleUnaryOperator curve = interpolator(xs, ys);
        double[] result = new double[targetXs.length];
        for (int i = 0; i < targetXs.length; i++) {
            result[i] = curve.applyAsDouble(targetXs[i]);
        }
        return result;
    }

    public static double valueAt(double[] xs, double[] ys, double x) {
        return interpolator(xs, ys).applyAsDouble(x);
    }

    /**
     * Piecewise-linear function through (xs, ys), flat beyond both ends.
     *
     * @param xs strictly increasing abscissae
     */
    public static DoubleUnaryOperator interpolator(double[] xs, double[] ys) {
        if (xs.length == 0 || xs.length != ys.length) {
            throw new IllegalArgumentException(String.format(
                    "Cannot resample a curve with %d abscissae and %d values", xs.length, ys.length));
        }
        int last = xs.length - 1;
        double first = ys[0];
        double end = ys[last];
        if (last == 0) {
            return x -> first;
        }
        double low = xs[0];
        double high = xs[last];
        PolynomialSplineFunction spline = new LinearInterpolator().interpolate(xs, ys);
        return x -> {
            if (x <= low) {
                return first;
            }
            if (x >= high) {
                return end;
            }
            return spline.value(x);
        };
    }
}
