/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core;

import ai.evacortex.peakalign.core.exceptions.InvalidSignalException;
import ai.evacortex.peakalign.core.math.SearchWindow;

import java.util.Arrays;

/**
 * Strictly increasing sampling positions shared by every signal of a batch.
 *
 * <p>The backing array is copied on the way in and on the way out, so an {@code Axis}
 * can be shared freely between worker threads.</p>
 */
public record Axis(double[] values) {

    public Axis {
        if (values == null) {
            throw new InvalidSignalException("axis must not be null");
        }
        if (values.length < 2) {
            throw new InvalidSignalException("axis needs at least 2 points, got " + values.length);
        }
        values = values.clone();
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new InvalidSignalException("axis value at " + i + " is not finite");
            }
            if (i > 0 && values[i] <= values[i - 1]) {
                throw new InvalidSignalException("axis must be strictly increasing (index " + i + ")");
            }
        }
    }

    public static Axis of(double... values) {
        return new Axis(values);
    }

    /** Index axis {@code 0, 1, ..., size - 1}. */
    public static Axis indices(int size) {
        double[] idx = new double[size];
        for (int i = 0; i < size; i++) {
            idx[i] = i;
        }
        return new Axis(idx);
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public double at(int index) {
        return values[index];
    }

    public double first() {
        return values[0];
    }

    public double last() {
        return values[values.length - 1];
    }

    public boolean contains(double x) {
        return x >= first() && x <= last();
    }

    public double meanSpacing() {
        return (last() - first()) / (values.length - 1);
    }

    /**
     * Index of the sample closest to {@code x}. Equidistant candidates resolve to the lower index;
     * positions outside the axis clamp to the nearest end.
     */
    public int nearestIndex(double x) {
        int pos = Arrays.binarySearch(values, x);
        if (pos >= 0) return pos;

        int upper = -pos - 1;
        if (upper == 0) return 0;
        if (upper == values.length) return values.length - 1;

        int lower = upper - 1;
        return (x - values[lower]) <= (values[upper] - x) ? lower : upper;
    }

    public double[] slice(SearchWindow window) {
        return Arrays.copyOfRange(values, window.lo(), window.hi());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Axis)) return false;
        return Arrays.equals(values, ((Axis) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return String.format("Axis[%d points, %.4f .. %.4f]", values.length, first(), last());
    }
}
