/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.math;

import ai.evacortex.peakalign.core.Axis;

/**
 * Carves the neighbourhood around a peak out of the shared axis.
 *
 * <p>Windows are clipped at the array bounds, never wrapped. A window clipped below
 * {@link SearchWindow#MIN_USABLE_WIDTH} is still returned; callers check
 * {@link SearchWindow#isUsable()} and leave the peak out of the score.</p>
 */
public final class WindowExtractor {

    private WindowExtractor() {}

    /**
     * @param axis       shared axis
     * @param location   peak position, either in axis units or as an index
     * @param halfWidth  number of samples kept on each side of the centre index
     * @param byIndex    treat {@code location} as an index instead of an axis value
     * @return the clipped window {@code [centre - halfWidth, centre + halfWidth]}
     */
    public static SearchWindow extract(Axis axis, double location, int halfWidth, boolean byIndex) {
        if (axis == null) {
            throw new NullPointerException("axis must not be null");
        }
        if (halfWidth < 0) {
            throw new IllegalArgumentException("halfWidth must be non-negative: " + halfWidth);
        }
        int centre = byIndex ? clampedIndex(location, axis.size()) : axis.nearestIndex(location);
        int lo = Math.max(0, centre - halfWidth);
        int hi = Math.min(axis.size(), centre + halfWidth + 1);
        return new SearchWindow(lo, hi);
    }

    static int clampedIndex(double location, int size) {
        if (Double.isNaN(location)) {
            throw new IllegalArgumentException("location must not be NaN");
        }
        long rounded = Math.round(location);
        return (int) Math.max(0, Math.min(size - 1, rounded));
    }
}
