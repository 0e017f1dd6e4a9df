/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.math;

/**
 * Half-open index range {@code [lo, hi)} into an axis and its signals.
 */
public record SearchWindow(int lo, int hi) {

    /** Narrowest window that still carries a usable peak shape. */
    public static final int MIN_USABLE_WIDTH = 3;

    public SearchWindow {
        if (lo < 0 || hi < lo) {
            throw new IllegalArgumentException("Invalid window [" + lo + ", " + hi + ")");
        }
    }

    public int width() {
        return hi - lo;
    }

    public boolean isUsable() {
        return width() >= MIN_USABLE_WIDTH;
    }
}
