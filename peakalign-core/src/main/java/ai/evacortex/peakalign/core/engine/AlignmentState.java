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
 * Lifecycle of an {@link AlignmentEngine}.
 * - CONFIGURED: axis, peaks and options set, nothing estimated yet.
 * - ESTIMATED: per-signal transforms computed and cached.
 * - APPLIED: an aligned batch has been produced from the cached transforms.
 */
public enum AlignmentState {
    CONFIGURED,
    ESTIMATED,
    APPLIED
}
