/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.math;

import ai.evacortex.peakalign.core.exceptions.InvalidAlignmentConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class InterpolatorTest {

    private static double[] range(double from, double to, double step) {
        int n = (int) Math.round((to - from) / step) + 1;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) x[i] = from + i * step;
        return x;
    }

    @ParameterizedTest
    @EnumSource(InterpolationMethod.class)
    @DisplayName("Positions outside the source axis resample to exactly 0, never NaN")
    void outOfDomain_isExactZero(InterpolationMethod method) {
        double[] x = range(0, 10, 1);
        double[] y = new double[x.length];
        for (int i = 0; i < y.length; i++) y[i] = 1.0 + Math.sin(x[i]);

        double[] newAxis = range(-5, 15, 0.25);
        double[] out = Interpolator.resample(y, x, newAxis, method);

        for (int i = 0; i < newAxis.length; i++) {
            assertFalse(Double.isNaN(out[i]), "NaN at " + newAxis[i]);
            if (newAxis[i] < 0 || newAxis[i] > 10) {
                assertEquals(0.0, out[i], 0.0, "Outside the domain at " + newAxis[i]);
            }
        }
    }

    @Test
    void linear_isExactOnLines() {
        double[] x = range(0, 10, 1);
        double[] y = new double[x.length];
        for (int i = 0; i < y.length; i++) y[i] = 2.0 * x[i] + 1.0;

        double[] out = Interpolator.resample(y, x, new double[]{0.5, 3.25, 10.0}, InterpolationMethod.LINEAR);
        assertArrayEquals(new double[]{2.0, 7.5, 21.0}, out, 1e-12);
    }

    @Test
    void pchip_isExactOnLines() {
        double[] x = range(0, 10, 1);
        double[] y = new double[x.length];
        for (int i = 0; i < y.length; i++) y[i] = 3.0 * x[i];

        double[] out = Interpolator.resample(y, x, new double[]{0.3, 2.5, 9.9}, InterpolationMethod.PCHIP);
        assertArrayEquals(new double[]{0.9, 7.5, 29.7}, out, 1e-9);
    }

    @Test
    void pchip_doesNotOvershootSteps() {
        double[] x = range(0, 5, 1);
        double[] y = {0, 0, 0, 1, 1, 1};

        double[] fine = range(0, 5, 0.01);
        double[] out = Interpolator.resample(y, x, fine, InterpolationMethod.PCHIP);

        for (int i = 0; i < out.length; i++) {
            assertTrue(out[i] >= -1e-12 && out[i] <= 1.0 + 1e-12, "Overshoot at " + fine[i] + ": " + out[i]);
            if (i > 0) {
                assertTrue(out[i] >= out[i - 1] - 1e-12, "Monotonicity lost at " + fine[i]);
            }
        }
    }

    @Test
    void pchip_slopesVanishAtExtrema() {
        double[] h = {1, 1, 1, 1};
        double[] m = {1, -1, 2, 2};
        double[] d = PchipInterpolator.slopes(h, m);
        assertEquals(5, d.length);
        assertEquals(0.0, d[1], 0.0);
        assertEquals(0.0, d[2], 0.0);
        assertEquals(2.0, d[3], 1e-12);
    }

    @ParameterizedTest
    @EnumSource(value = InterpolationMethod.class, names = {"LINEAR", "PCHIP", "CUBIC"})
    void splinesPassThroughKnots(InterpolationMethod method) {
        double[] x = {0.0, 0.7, 1.5, 3.0, 3.2, 6.0};
        double[] y = {1.0, -2.0, 0.5, 4.0, 4.1, 0.0};
        assertArrayEquals(y, Interpolator.resample(y, x, x, method), 1e-9);
    }

    @Test
    void zeroOrderHold_keepsPreviousSample() {
        double[] x = range(0, 4, 1);
        double[] y = {1, 2, 3, 4, 5};
        double[] out = Interpolator.resample(y, x, new double[]{0.0, 1.7, 2.0, 3.99, 4.0}, InterpolationMethod.ZERO);
        assertArrayEquals(new double[]{1, 2, 3, 4, 5}, out, 0.0);
    }

    @Test
    void twoPoints_degradeToLinear() {
        double[] x = {0.0, 1.0};
        double[] y = {0.0, 2.0};
        assertEquals(1.0, Interpolator.resample(y, x, new double[]{0.5}, InterpolationMethod.CUBIC)[0], 1e-12);
        assertEquals(1.0, Interpolator.resample(y, x, new double[]{0.5}, InterpolationMethod.PCHIP)[0], 1e-12);
    }

    @Test
    void mismatchedInput_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> Interpolator.resample(new double[]{1, 2}, new double[]{0, 1, 2}, new double[]{1}, InterpolationMethod.LINEAR));
        assertThrows(IllegalArgumentException.class,
                () -> Interpolator.resample(new double[]{1}, new double[]{0}, new double[]{0}, InterpolationMethod.CUBIC));
        assertThrows(NullPointerException.class,
                () -> Interpolator.resample(new double[]{1, 2}, new double[]{0, 1}, null, InterpolationMethod.CUBIC));
    }

    @Test
    void methodNames_matchExactly() {
        assertEquals(InterpolationMethod.PCHIP, InterpolationMethod.fromName("pchip"));
        assertEquals(InterpolationMethod.CUBIC, InterpolationMethod.fromName("cubic"));
        assertEquals("zero", InterpolationMethod.ZERO.id());
        assertEquals(InterpolationMethod.LINEAR, InterpolationMethod.fromName("slinear"));
        assertEquals("linear", InterpolationMethod.fromName("slinear").id());
        assertThrows(InvalidAlignmentConfigException.class, () -> InterpolationMethod.fromName("SLinear"));
        assertThrows(InvalidAlignmentConfigException.class, () -> InterpolationMethod.fromName("pChIp"));
        assertThrows(InvalidAlignmentConfigException.class, () -> InterpolationMethod.fromName("LINEAR"));
        assertThrows(InvalidAlignmentConfigException.class, () -> InterpolationMethod.fromName(null));
    }
}
