/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.engine;

import ai.evacortex.peakalign.core.AlignedBatch;
import ai.evacortex.peakalign.core.Axis;
import ai.evacortex.peakalign.core.Batch;
import ai.evacortex.peakalign.core.PeakSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static ai.evacortex.peakalign.core.SignalTestUtils.pulses;
import static org.junit.jupiter.api.Assertions.*;

class AlignmentEngineConcurrencyTest {

    private static final Axis AXIS = Axis.indices(160);
    private static final PeakSet PEAKS = PeakSet.weighted(new double[]{50, 110}, new double[]{1, 2});
    private static final AlignmentConfig CONFIG = AlignmentConfig.builder()
            .shiftRange(-12, 12)
            .returnShifts(true)
            .build();

    private static Batch randomBatch(int rows, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[rows][];
        for (int k = 0; k < rows; k++) {
            double shift = random.nextDouble() * 16 - 8;
            double stretch = 1.0 + random.nextDouble() * 0.06 - 0.03;
            data[k] = pulses(AXIS, 3.0, 50 * stretch + shift, 110 * stretch + shift);
        }
        return Batch.of(data);
    }

    @Test
    @Timeout(120)
    void parallelRun_matchesSerialRun() {
        Batch batch = randomBatch(48, 42);

        AlignedBatch serial;
        try (AlignmentEngine e = new AlignmentEngine(AXIS, PEAKS, CONFIG, new CosineScorer(), 1)) {
            e.estimate(batch);
            serial = e.apply(batch);
        }

        AlignedBatch parallel;
        try (AlignmentEngine e = new AlignmentEngine(AXIS, PEAKS, CONFIG, new CosineScorer(), 8)) {
            e.estimate(batch);
            parallel = e.apply(batch);
        }

        assertEquals(serial.transforms(), parallel.transforms(), "Row results must not depend on scheduling");
        assertArrayEquals(serial.signals().toArray(), parallel.signals().toArray());
    }

    @Test
    @Timeout(60)
    void interruptedEstimate_publishesNothing() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        GridScorer blocking = new GridScorer() {
            private final CosineScorer inner = new CosineScorer();

            @Override
            public double score(double[] window, double[] template) {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("scoring interrupted", e);
                }
                return inner.score(window, template);
            }
        };

        try (AlignmentEngine e = new AlignmentEngine(AXIS, PEAKS, CONFIG, blocking, 2)) {
            AtomicReference<Throwable> thrown = new AtomicReference<>();
            AtomicBoolean flagRestored = new AtomicBoolean(false);
            Thread caller = new Thread(() -> {
                try {
                    e.estimate(randomBatch(4, 7));
                } catch (Throwable t) {
                    thrown.set(t);
                    flagRestored.set(Thread.currentThread().isInterrupted());
                }
            }, "estimate-caller");

            caller.start();
            try {
                assertTrue(started.await(30, TimeUnit.SECONDS), "row tasks never started");
                caller.interrupt();
                caller.join(TimeUnit.SECONDS.toMillis(30));
            } finally {
                release.countDown();
            }

            assertFalse(caller.isAlive());
            assertInstanceOf(CancellationException.class, thrown.get());
            assertTrue(flagRestored.get(), "interrupt flag must be restored");
            assertTrue(e.lastEstimate().isEmpty());
            assertEquals(AlignmentState.CONFIGURED, e.state());
        }
    }
}
