/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.math;

import java.util.Arrays;

/**
 * Whole-sample shifts without interpolation. Vacated samples take the fill value; nothing wraps around.
 */
public final class SignalShifter {

    private SignalShifter() {}

    /**
     * @param values samples to move
     * @param num    positive moves content towards higher indices, negative towards lower
     * @param fill   value written into vacated samples
     */
    public static double[] shift(double[] values, int num, double fill) {
        int n = values.length;
        double[] out = new double[n];
        if (num == 0) {
            System.arraycopy(values, 0, out, 0, n);
        } else if (num > 0) {
            int k = Math.min(num, n);
            Arrays.fill(out, 0, k, fill);
            System.arraycopy(values, 0, out, k, n - k);
        } else {
            int k = Math.min(-num, n);
            System.arraycopy(values, k, out, 0, n - k);
            Arrays.fill(out, n - k, n, fill);
        }
        return out;
    }
}
