/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.util;

import java.util.Locale;

/**
 * Compact human readable durations for log lines.
 */
public final class Durations {

    private Durations() {}

    public static String format(long nanos) {
        double seconds = nanos / 1e9;
        if (seconds <= 0.005) return String.format(Locale.ROOT, "%.0fus", seconds * 1e6);
        if (seconds <= 0.1) return String.format(Locale.ROOT, "%.1fms", seconds * 1e3);
        if (seconds > 86400) return String.format(Locale.ROOT, "%.2fday", seconds / 86400);
        if (seconds > 1800) return String.format(Locale.ROOT, "%.2fhr", seconds / 3600);
        if (seconds > 60) return String.format(Locale.ROOT, "%.2fmin", seconds / 60);
        return String.format(Locale.ROOT, "%.2fs", seconds);
    }

    /** Elapsed time since {@code startNanos} plus the average per item. */
    public static String perItem(long startNanos, int items) {
        long elapsed = System.nanoTime() - startNanos;
        long avg = items > 0 ? elapsed / items : elapsed;
        return "[Avg: " + format(avg) + " | Tot: " + format(elapsed) + "]";
    }
}
