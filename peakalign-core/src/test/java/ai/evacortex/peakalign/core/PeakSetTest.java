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
import ai.evacortex.peakalign.core.exceptions.InvalidSignalException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeakSetTest {

    @Test
    void uniformPeaks_haveUnitWeight() {
        PeakSet peaks = PeakSet.uniform(10.0, -40.0, 25.0);
        assertEquals(3, peaks.size());
        assertEquals(3.0, peaks.totalWeight(), 0.0);
        assertEquals(40.0, peaks.maxAbsLocation(), 0.0);
        assertArrayEquals(new double[]{10.0, -40.0, 25.0}, peaks.locations());
    }

    @Test
    void weightedPeaks_keepOrderAndWeights() {
        PeakSet peaks = PeakSet.weighted(new double[]{40, 70}, new double[]{60, 100});
        assertEquals(new ReferencePeak(40, 60), peaks.get(0));
        assertEquals(new ReferencePeak(70, 100), peaks.get(1));
        assertEquals(160.0, peaks.totalWeight(), 0.0);
    }

    @Test
    void weighted_nullWeightsMeansUniform() {
        PeakSet peaks = PeakSet.weighted(new double[]{1, 2}, null);
        assertEquals(PeakSet.uniform(1, 2), peaks);
    }

    @Test
    void weightCountMismatch_isRejected() {
        InvalidPeakSetException ex = assertThrows(InvalidPeakSetException.class,
                () -> PeakSet.weighted(new double[]{40, 70}, new double[]{1.0}));
        assertTrue(ex.getMessage().contains("Number of weights does not match number of peaks"));
    }

    @Test
    void invalidPeaks_areRejected() {
        assertThrows(InvalidPeakSetException.class, () -> new PeakSet(List.of()));
        assertThrows(InvalidPeakSetException.class, () -> PeakSet.uniform());
        assertThrows(InvalidPeakSetException.class, () -> new ReferencePeak(1.0, 0.0));
        assertThrows(InvalidPeakSetException.class, () -> new ReferencePeak(1.0, -2.0));
        assertThrows(InvalidPeakSetException.class, () -> new ReferencePeak(Double.NaN, 1.0));
        assertThrows(InvalidPeakSetException.class, () -> new ReferencePeak(1.0, Double.POSITIVE_INFINITY));
    }

    @Test
    void batch_rejectsRaggedOrEmptyRows() {
        assertThrows(InvalidSignalException.class, () -> new Batch(List.of()));
        assertThrows(InvalidSignalException.class, () -> Batch.of(new double[]{1, 2, 3}, new double[]{1, 2}));
        Batch ok = Batch.of(new double[]{1, 2, 3}, new double[]{4, 5, 6});
        assertEquals(2, ok.size());
        assertEquals(3, ok.width());
        assertArrayEquals(new double[]{4, 5, 6}, ok.toArray()[1]);
    }

    @Test
    void transform_roundTripsCoordinates() {
        Transform t = new Transform(-3.0, 1.05);
        double signalPos = t.toSignalCoordinate(40.0);
        assertEquals(45.0, signalPos, 1e-12);
        assertEquals(40.0, t.toReferenceCoordinate(signalPos), 1e-12);
        assertTrue(Transform.shift(2.0).isShiftOnly());
        assertFalse(t.isShiftOnly());
    }
}
