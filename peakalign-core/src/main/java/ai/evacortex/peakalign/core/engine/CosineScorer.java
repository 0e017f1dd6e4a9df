/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.engine;

/**
 * Normalized dot product of window and template:
 * <pre>
 *     S = ⟨w, t⟩ / (‖w‖ · ‖t‖)      S ∈ [−1, 1]
 * </pre>
 * Invariant to the overall intensity of either vector, so signals of different amplitude compete fairly.
 */
public final class CosineScorer implements GridScorer {

    @Override
    public double score(double[] window, double[] template) {
        if (window == null || template == null) {
            throw new NullPointerException("window and template must not be null");
        }
        if (window.length != template.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + window.length + " vs " + template.length);
        }

        double dot = 0.0;
        double energyW = 0.0;
        double energyT = 0.0;
        for (int i = 0; i < window.length; i++) {
            dot     += window[i] * template[i];
            energyW += window[i] * window[i];
            energyT += template[i] * template[i];
        }

        if (energyW == 0.0 || energyT == 0.0) return Double.NEGATIVE_INFINITY;

        double s = dot / (Math.sqrt(energyW) * Math.sqrt(energyT));
        return Math.max(-1.0, Math.min(1.0, s));
    }
}
