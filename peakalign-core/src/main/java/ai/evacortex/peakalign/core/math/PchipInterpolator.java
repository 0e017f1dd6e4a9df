/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.math;

import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.util.MathArrays;

/**
 * Piecewise cubic Hermite interpolating polynomial (Fritsch–Carlson), shape preserving:
 * the interpolant never overshoots the data and stays monotone wherever the data is.
 *
 * <p>Interior slopes are the weighted harmonic mean of the adjacent secants, or zero at local extrema.
 * End slopes use the three-point one-sided estimate, limited so they cannot change sign or exceed
 * three times the end secant.</p>
 */
public final class PchipInterpolator implements UnivariateInterpolator {

    @Override
    public PolynomialSplineFunction interpolate(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new DimensionMismatchException(x.length, y.length);
        }
        if (x.length < 2) {
            throw new NumberIsTooSmallException(x.length, 2, true);
        }
        MathArrays.checkOrder(x);

        int n = x.length;
        double[] h = new double[n - 1];
        double[] m = new double[n - 1];
        for (int k = 0; k < n - 1; k++) {
            h[k] = x[k + 1] - x[k];
            m[k] = (y[k + 1] - y[k]) / h[k];
        }

        double[] d = slopes(h, m);

        PolynomialFunction[] pieces = new PolynomialFunction[n - 1];
        for (int k = 0; k < n - 1; k++) {
            double c2 = (3.0 * m[k] - 2.0 * d[k] - d[k + 1]) / h[k];
            double c3 = (d[k] + d[k + 1] - 2.0 * m[k]) / (h[k] * h[k]);
            pieces[k] = new PolynomialFunction(new double[]{y[k], d[k], c2, c3});
        }
        return new PolynomialSplineFunction(x.clone(), pieces);
    }

    static double[] slopes(double[] h, double[] m) {
        int n = h.length + 1;
        double[] d = new double[n];
        if (n == 2) {
            d[0] = m[0];
            d[1] = m[0];
            return d;
        }

        for (int k = 1; k < n - 1; k++) {
            double left = m[k - 1];
            double right = m[k];
            if (left == 0.0 || right == 0.0 || Math.signum(left) != Math.signum(right)) {
                d[k] = 0.0;
                continue;
            }
            double w1 = 2.0 * h[k] + h[k - 1];
            double w2 = h[k] + 2.0 * h[k - 1];
            d[k] = (w1 + w2) / (w1 / left + w2 / right);
        }

        d[0] = edgeSlope(h[0], h[1], m[0], m[1]);
        d[n - 1] = edgeSlope(h[n - 2], h[n - 3], m[n - 2], m[n - 3]);
        return d;
    }

    private static double edgeSlope(double h0, double h1, double m0, double m1) {
        double d = ((2.0 * h0 + h1) * m0 - h0 * m1) / (h0 + h1);
        if (Math.signum(d) != Math.signum(m0)) {
            return 0.0;
        }
        if (Math.signum(m0) != Math.signum(m1) && Math.abs(d) > 3.0 * Math.abs(m0)) {
            return 3.0 * m0;
        }
        return d;
    }
}
