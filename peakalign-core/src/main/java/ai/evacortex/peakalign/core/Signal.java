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

import java.util.Arrays;

/**
 * Intensities sampled on an {@link Axis}. Immutable once constructed; every sample is finite.
 */
public record Signal(double[] intensities) {

    public Signal {
        if (intensities == null) {
            throw new InvalidSignalException("intensities must not be null");
        }
        intensities = intensities.clone();
        for (int i = 0; i < intensities.length; i++) {
            if (!Double.isFinite(intensities[i])) {
                throw new InvalidSignalException("intensity at " + i + " is not finite");
            }
        }
    }

    public static Signal of(double... intensities) {
        return new Signal(intensities);
    }

    @Override
    public double[] intensities() {
        return intensities.clone();
    }

    public int size() {
        return intensities.length;
    }

    public double at(int index) {
        return intensities[index];
    }

    /** Copies {@code [lo, hi)} into a fresh array. */
    public double[] slice(int lo, int hi) {
        return Arrays.copyOfRange(intensities, lo, hi);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Signal)) return false;
        return Arrays.equals(intensities, ((Signal) obj).intensities);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(intensities);
    }

    @Override
    public String toString() {
        return "Signal[" + intensities.length + " samples]";
    }
}
