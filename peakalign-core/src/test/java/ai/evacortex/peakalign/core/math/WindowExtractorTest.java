package ai.evacortex.peakalign.core.math;

import ai.evacortex.peakalign.core.Axis;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WindowExtractorTest {

    private final Axis axis = Axis.indices(100);

    @Test
    void interiorWindow_isSymmetricAroundCentre() {
        SearchWindow w = WindowExtractor.extract(axis, 50.0, 10, false);
        assertEquals(new SearchWindow(40, 61), w);
        assertEquals(21, w.width());
        assertTrue(w.isUsable());
    }

    @Test
    void windowsAtArrayEnds_areClippedNotWrapped() {
        assertEquals(new SearchWindow(0, 11), WindowExtractor.extract(axis, 0.0, 10, false));
        assertEquals(new SearchWindow(89, 100), WindowExtractor.extract(axis, 99.0, 10, false));
        assertEquals(new SearchWindow(0, 11), WindowExtractor.extract(axis, -250.0, 10, false));
        assertEquals(new SearchWindow(89, 100), WindowExtractor.extract(axis, 1e6, 10, false));
    }

    @Test
    void narrowClippedWindow_isNotUsable() {
        SearchWindow w = WindowExtractor.extract(axis, 0.0, 1, false);
        assertEquals(new SearchWindow(0, 2), w);
        assertFalse(w.isUsable(), "A window of 2 samples must be skipped");

        SearchWindow zero = WindowExtractor.extract(axis, 50.0, 0, false);
        assertEquals(1, zero.width());
        assertFalse(zero.isUsable());
    }

    @Test
    void valueMode_tieGoesToLowerIndex() {
        assertEquals(new SearchWindow(2, 7), WindowExtractor.extract(axis, 4.5, 2, false));
    }

    @Test
    void valueMode_onNonUniformAxis() {
        Axis sparse = Axis.of(0.0, 0.5, 2.0, 5.0, 10.0, 20.0, 40.0);
        assertEquals(new SearchWindow(1, 4), WindowExtractor.extract(sparse, 3.0, 1, false));
    }

    @Test
    void indexMode_roundsAndClamps() {
        assertEquals(new SearchWindow(9, 14), WindowExtractor.extract(axis, 10.6, 2, true));
        assertEquals(new SearchWindow(0, 3), WindowExtractor.extract(axis, -3.0, 2, true));
        assertEquals(new SearchWindow(97, 100), WindowExtractor.extract(axis, 140.2, 2, true));
        assertEquals(0, WindowExtractor.clampedIndex(-0.4, 100));
        assertEquals(99, WindowExtractor.clampedIndex(99.49, 100));
    }

    @Test
    void invalidArguments_throw() {
        assertThrows(NullPointerException.class, () -> WindowExtractor.extract(null, 1.0, 2, false));
        assertThrows(IllegalArgumentException.class, () -> WindowExtractor.extract(axis, 1.0, -1, false));
        assertThrows(IllegalArgumentException.class, () -> WindowExtractor.extract(axis, Double.NaN, 2, true));
    }
}
