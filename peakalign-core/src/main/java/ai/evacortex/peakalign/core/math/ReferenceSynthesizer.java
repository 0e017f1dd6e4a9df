/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.math;

import ai.evacortex.peakalign.core.PeakSet;
import ai.evacortex.peakalign.core.ReferencePeak;
import ai.evacortex.peakalign.core.Transform;

/**
 * Builds the synthetic template the observed windows are scored against.
 *
 * <p>Every reference peak contributes a unit-area Gaussian pulse</p>
 * <pre>
 *     g(x) = w · exp(−((x − c) / σ)²) / (σ · √π)
 *     c    = scale · location − offset
 *     σ    = width · scale
 * </pre>
 * <p>placed where the candidate {@link Transform} expects the peak to appear in the uncorrected signal.
 * Pulses are cut off at {@value #SUPPORT} widths from their centre, so a pulse that misses the window
 * contributes exactly zero.</p>
 */
public final class ReferenceSynthesizer {

    static final double SUPPORT = 4.0;
    private static final double SQRT_PI = Math.sqrt(Math.PI);

    private ReferenceSynthesizer() {}

    public static double[] synthesize(double[] windowAxis, PeakSet peaks, Transform transform, double width) {
        if (windowAxis == null || peaks == null || transform == null) {
            throw new NullPointerException("windowAxis, peaks and transform must not be null");
        }
        if (!(width > 0.0) || Double.isInfinite(width)) {
            throw new IllegalArgumentException("width must be positive and finite: " + width);
        }
        if (!(transform.scale() > 0.0)) {
            throw new IllegalArgumentException("scale must be positive: " + transform.scale());
        }

        double sigma = width * transform.scale();
        double reach = SUPPORT * sigma;
        double norm = 1.0 / (sigma * SQRT_PI);

        double[] template = new double[windowAxis.length];
        for (ReferencePeak peak : peaks.peaks()) {
            double centre = transform.toSignalCoordinate(peak.location());
            double amplitude = peak.weight() * norm;
            for (int i = 0; i < windowAxis.length; i++) {
                double dx = windowAxis[i] - centre;
                if (Math.abs(dx) > reach) continue;
                double u = dx / sigma;
                template[i] += amplitude * Math.exp(-u * u);
            }
        }
        return template;
    }
}
