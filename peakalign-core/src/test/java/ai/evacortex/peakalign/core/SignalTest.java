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
import org.junit.jupiter.api.Test;

import static ai.evacortex.peakalign.core.SignalTestUtils.gaussian;
import static org.junit.jupiter.api.Assertions.*;

class SignalTest {

    @Test
    void nonFiniteIntensities_areRejected() {
        double[] values = gaussian(Axis.indices(100), 53.0, 4.0, 1.0);
        values[52] = Double.NaN;
        InvalidSignalException ex = assertThrows(InvalidSignalException.class, () -> new Signal(values));
        assertTrue(ex.getMessage().contains("52"));

        assertThrows(InvalidSignalException.class, () -> Signal.of(1.0, Double.POSITIVE_INFINITY));
        assertThrows(InvalidSignalException.class, () -> Signal.of(Double.NEGATIVE_INFINITY, 1.0));
        assertThrows(InvalidSignalException.class, () -> Batch.of(new double[]{0, 1}, new double[]{Double.NaN, 1}));
        assertThrows(InvalidSignalException.class, () -> new Signal(null));
    }

    @Test
    void intensitiesAreDefensivelyCopied() {
        double[] raw = {1.0, 2.0, 3.0};
        Signal signal = new Signal(raw);
        raw[0] = 9.0;
        assertEquals(1.0, signal.at(0));

        double[] out = signal.intensities();
        out[1] = 9.0;
        assertEquals(2.0, signal.at(1));
        assertArrayEquals(new double[]{2.0, 3.0}, signal.slice(1, 3));
    }

    @Test
    void equalityFollowsContent() {
        assertEquals(Signal.of(1, 2, 3), Signal.of(1, 2, 3));
        assertEquals(Signal.of(1, 2, 3).hashCode(), Signal.of(1, 2, 3).hashCode());
        assertNotEquals(Signal.of(1, 2, 3), Signal.of(1, 2, 4));
    }
}
