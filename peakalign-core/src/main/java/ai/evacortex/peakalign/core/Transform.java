/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core;

/**
 * Per-signal correction found by the search.
 *
 * <p>{@code offset} is the correction applied to the signal, not the displacement observed in it:
 * a signal whose features sit {@code d} units right of the reference is corrected with
 * {@code offset = -d}. The distortion model is</p>
 * <pre>
 *     signalPosition    = scale · referencePosition − offset
 *     referencePosition = (signalPosition + offset) / scale
 * </pre>
 */
public record Transform(double offset, double scale) {

    public static final Transform IDENTITY = new Transform(0.0, 1.0);

    public static Transform shift(double offset) {
        return new Transform(offset, 1.0);
    }

    /** Where a reference position lands in the uncorrected signal. */
    public double toSignalCoordinate(double referencePosition) {
        return scale * referencePosition - offset;
    }

    /** Where an uncorrected signal position belongs once the correction is applied. */
    public double toReferenceCoordinate(double signalPosition) {
        return (signalPosition + offset) / scale;
    }

    public boolean isShiftOnly() {
        return scale == 1.0;
    }
}
