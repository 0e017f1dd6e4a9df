/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core;

import ai.evacortex.peakalign.core.exceptions.InvalidPeakSetException;

/**
 * A reference location the signals are aligned to, with its relative importance.
 */
public record ReferencePeak(double location, double weight) {

    public ReferencePeak {
        if (!Double.isFinite(location)) {
            throw new InvalidPeakSetException("peak location must be finite: " + location);
        }
        if (!Double.isFinite(weight) || weight <= 0.0) {
            throw new InvalidPeakSetException("peak weight must be positive: " + weight);
        }
    }

    public static ReferencePeak at(double location) {
        return new ReferencePeak(location, 1.0);
    }
}
