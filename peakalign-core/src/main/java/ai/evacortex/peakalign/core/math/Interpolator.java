/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.math;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;

import java.util.Arrays;
import java.util.Objects;

/**
 * Resamples a signal from one axis onto another.
 *
 * <p>Positions outside {@code [axis.first, axis.last]} evaluate to exactly {@code 0}: regions the
 * original axis never covered carry no intensity. Nothing is extrapolated and no {@code NaN} escapes.</p>
 */
public final class Interpolator {

    private Interpolator() {}

    public static double[] resample(double[] values, double[] axis, double[] newAxis, InterpolationMethod method) {
        Objects.requireNonNull(newAxis, "newAxis must not be null");
        UnivariateFunction f = function(axis, values, method);
        double[] out = new double[newAxis.length];
        for (int i = 0; i < newAxis.length; i++) {
            out[i] = f.value(newAxis[i]);
        }
        return out;
    }

    /**
     * Builds the interpolant of {@code (x, y)}, zero outside {@code [x[0], x[n-1]]}.
     *
     * @throws IllegalArgumentException if the arrays differ in length or hold fewer than 2 points
     */
    public static UnivariateFunction function(double[] x, double[] y, InterpolationMethod method) {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        Objects.requireNonNull(method, "method must not be null");
        if (x.length != y.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + x.length + " vs " + y.length);
        }
        if (x.length < 2) {
            throw new IllegalArgumentException("At least 2 points required, got " + x.length);
        }

        UnivariateFunction inner = switch (method) {
            case ZERO -> zeroOrderHold(x.clone(), y.clone());
            case LINEAR -> new LinearInterpolator().interpolate(x, y);
            case PCHIP -> spline(new PchipInterpolator(), x, y);
            case CUBIC -> spline(new SplineInterpolator(), x, y);
        };
        return new Bounded(inner, x[0], x[x.length - 1]);
    }

    // spline fits need a third knot; two points are joined linearly
    private static UnivariateFunction spline(UnivariateInterpolator interpolator, double[] x, double[] y) {
        if (x.length < 3) {
            return new LinearInterpolator().interpolate(x, y);
        }
        return interpolator.interpolate(x, y);
    }

    private static UnivariateFunction zeroOrderHold(double[] x, double[] y) {
        return v -> {
            int pos = Arrays.binarySearch(x, v);
            if (pos >= 0) return y[pos];
            return y[-pos - 2];
        };
    }

    private record Bounded(UnivariateFunction inner, double lo, double hi) implements UnivariateFunction {
        @Override
        public double value(double v) {
            if (!(v >= lo && v <= hi)) return 0.0;
            double r = inner.value(v);
            return Double.isNaN(r) ? 0.0 : r;
        }
    }
}
