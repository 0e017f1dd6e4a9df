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
import ai.evacortex.peakalign.core.AlignmentResult;
import ai.evacortex.peakalign.core.Axis;
import ai.evacortex.peakalign.core.Batch;
import ai.evacortex.peakalign.core.PeakSet;
import ai.evacortex.peakalign.core.ReferencePeak;
import ai.evacortex.peakalign.core.Signal;
import ai.evacortex.peakalign.core.Transform;
import ai.evacortex.peakalign.core.exceptions.AlignmentStateException;
import ai.evacortex.peakalign.core.exceptions.InvalidPeakSetException;
import ai.evacortex.peakalign.core.exceptions.InvalidSignalException;
import ai.evacortex.peakalign.core.math.Interpolator;
import ai.evacortex.peakalign.core.math.SignalShifter;
import ai.evacortex.peakalign.core.util.Durations;
import ai.evacortex.peakalign.core.util.SignalFingerprint;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.IntFunction;

/**
 * {@code AlignmentEngine} aligns batches of signals sharing one axis to a fixed set of reference peaks.
 *
 * <p>The engine owns the axis, the peaks and the {@link AlignmentConfig} for its whole lifetime; batches are
 * only borrowed for the duration of a call. Work moves through three states:</p>
 * <ul>
 *     <li>{@link AlignmentState#CONFIGURED}: inputs validated, nothing estimated</li>
 *     <li>{@link AlignmentState#ESTIMATED}: {@link #estimate(Batch)} produced an {@link EstimatedAlignment}</li>
 *     <li>{@link AlignmentState#APPLIED}: an aligned batch was produced from the cached estimate</li>
 * </ul>
 *
 * <p>Rows are independent. Each row is searched and resampled by its own task on a work-stealing pool,
 * writing a single result slot; the estimate is published only after every slot is filled. Interrupting
 * the calling thread cancels the outstanding rows and publishes nothing.</p>
 *
 * <p>A changed configuration or peak set needs a new engine ({@link #withConfig}, {@link #withPeaks});
 * results are never carried across.</p>
 *
 * @see MultiResolutionSearch
 * @see EstimatedAlignment
 */
public class AlignmentEngine implements Closeable {

    private static final Logger LOGGER = LogManager.getFormatterLogger(AlignmentEngine.class);

    private static final int PARALLELISM = Integer.getInteger("peakalign.parallelism",
            Runtime.getRuntime().availableProcessors());
    private static final int SINGLE_CACHE_SIZE = Integer.getInteger("peakalign.cache.maxSignals", 1024);

    private final Axis axis;
    private final Axis workingAxis;
    private final PeakSet peaks;
    private final AlignmentConfig config;
    private final GridScorer scorer;
    private final int parallelism;
    private final MultiResolutionSearch search;

    private final ExecutorService executor;
    private final Cache<Long, CachedResult> singleResults;
    private final AtomicReference<EstimatedAlignment> estimate = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile AlignmentState state = AlignmentState.CONFIGURED;

    public AlignmentEngine(Axis axis, PeakSet peaks, AlignmentConfig config) {
        this(axis, peaks, config, new CosineScorer(), PARALLELISM);
    }

    public AlignmentEngine(Axis axis, PeakSet peaks, AlignmentConfig config, GridScorer scorer, int parallelism) {
        this.axis = Objects.requireNonNull(axis, "axis must not be null");
        this.peaks = Objects.requireNonNull(peaks, "peaks must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;

        validatePeaks(axis, peaks, config.alignByIndex());
        this.workingAxis = config.alignByIndex() ? Axis.indices(axis.size()) : axis;
        this.search = new MultiResolutionSearch(workingAxis, peaks, config, scorer);

        this.executor = Executors.newWorkStealingPool(parallelism);
        this.singleResults = Caffeine.newBuilder()
                .maximumSize(SINGLE_CACHE_SIZE)
                .build();

        if (config.alignByIndex()) {
            LOGGER.debug("Aligning by index - peak positions: %s", Arrays.toString(peaks.locations()));
        }
        LOGGER.info("Configured engine: %d peaks on %s, scale search %s, peak width %.4f",
                peaks.size(), axis, search.searchesScale() ? "on" : "off", search.width());
    }

    /**
     * Builds an engine, estimates and applies the alignment of {@code batch}, and shuts the engine down.
     *
     * @return the aligned batch; transforms are attached when {@link AlignmentConfig#returnShifts()} is set
     */
    public static AlignedBatch align(Axis axis, Batch batch, PeakSet peaks, AlignmentConfig config) {
        try (AlignmentEngine engine = new AlignmentEngine(axis, peaks, config)) {
            engine.estimate(batch);
            return engine.apply(batch);
        }
    }

    /**
     * Searches every row of {@code batch} for its best transform and caches the results,
     * replacing any previous estimate.
     */
    public EstimatedAlignment estimate(Batch batch) {
        ensureOpen();
        checkBatch(batch);

        long start = System.nanoTime();
        List<AlignmentResult> results = mapRows(batch.size(), row -> search.search(batch.row(row)));
        EstimatedAlignment estimated = new EstimatedAlignment(this, results);

        estimate.set(estimated);
        state = AlignmentState.ESTIMATED;

        long unconfident = estimated.unconfidentCount();
        if (unconfident > 0) {
            LOGGER.warn("%d of %d signals produced no confident alignment", unconfident, batch.size());
        }
        LOGGER.info("Processed %d signals %s", batch.size(), Durations.perItem(start, batch.size()));
        return estimated;
    }

    /**
     * Aligns {@code batch} with the transforms cached by the last {@link #estimate(Batch)}.
     *
     * @throws AlignmentStateException if nothing has been estimated yet, or the row count differs
     */
    public AlignedBatch apply(Batch batch) {
        EstimatedAlignment estimated = estimate.get();
        if (estimated == null) {
            throw new AlignmentStateException("Alignment has not been estimated; call estimate() first");
        }
        return estimated.apply(batch);
    }

    /**
     * Searches a single signal that was not part of the estimated batch, with this engine's axis,
     * peaks and options. Repeated calls with identical content are answered from a bounded cache.
     */
    public AlignmentResult estimateOne(Signal signal) {
        ensureOpen();
        checkSignal(signal);
        return cachedSearch(SignalFingerprint.of(signal), signal);
    }

    /** Resamples one signal with {@code transform}, independent of any cached estimate. */
    public Signal realign(Signal signal, Transform transform) {
        checkSignal(signal);
        Objects.requireNonNull(transform, "transform must not be null");
        if (config.quickShift()) {
            int n = signal.size();
            long whole = Math.round(transform.offset());
            int num = (int) Math.max(-n, Math.min(n, whole));
            return new Signal(SignalShifter.shift(signal.intensities(), num, 0.0));
        }

        int n = workingAxis.size();
        double[] positions = new double[n];
        for (int i = 0; i < n; i++) {
            positions[i] = transform.toReferenceCoordinate(workingAxis.at(i));
        }
        return new Signal(Interpolator.resample(signal.intensities(), positions, workingAxis.values(), config.method()));
    }

    public AlignmentEngine withConfig(AlignmentConfig newConfig) {
        return new AlignmentEngine(axis, peaks, newConfig, scorer, parallelism);
    }

    public AlignmentEngine withPeaks(PeakSet newPeaks) {
        return new AlignmentEngine(axis, newPeaks, config, scorer, parallelism);
    }

    public AlignmentState state() {
        return state;
    }

    public Optional<EstimatedAlignment> lastEstimate() {
        return Optional.ofNullable(estimate.get());
    }

    public Axis axis() {
        return axis;
    }

    public PeakSet peaks() {
        return peaks;
    }

    public AlignmentConfig config() {
        return config;
    }

    public MultiResolutionSearch search() {
        return search;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        singleResults.invalidateAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    List<Signal> realignRows(Batch batch, EstimatedAlignment estimated) {
        ensureOpen();
        checkBatch(batch);

        long start = System.nanoTime();
        List<Signal> aligned = mapRows(batch.size(),
                row -> realign(batch.row(row), estimated.result(row).transform()));
        state = AlignmentState.APPLIED;
        LOGGER.info("Re-aligned %d signals %s", batch.size(), Durations.perItem(start, batch.size()));
        return aligned;
    }

    // fingerprints may collide, so a hit only counts when the stored signal matches
    AlignmentResult cachedSearch(long fingerprint, Signal signal) {
        CachedResult hit = singleResults.getIfPresent(fingerprint);
        if (hit != null && hit.signal().equals(signal)) {
            return hit.result();
        }
        AlignmentResult result = search.search(signal);
        singleResults.put(fingerprint, new CachedResult(signal, result));
        return result;
    }

    private <T> List<T> mapRows(int rows, IntFunction<T> task) {
        AtomicReferenceArray<T> slots = new AtomicReferenceArray<>(rows);
        List<Future<?>> futures = new ArrayList<>(rows);
        try {
            for (int i = 0; i < rows; i++) {
                final int row = i;
                futures.add(executor.submit(() -> slots.set(row, task.apply(row))));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Alignment interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Row task failed", cause);
        }

        List<T> out = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            out.add(slots.get(i));
        }
        return out;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new AlignmentStateException("Engine is closed");
        }
    }

    private void checkBatch(Batch batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        if (batch.width() != axis.size()) {
            throw new InvalidSignalException("batch rows have " + batch.width() + " samples, axis has " + axis.size());
        }
    }

    private void checkSignal(Signal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        if (signal.size() != axis.size()) {
            throw new InvalidSignalException("signal has " + signal.size() + " samples, axis has " + axis.size());
        }
    }

    private static void validatePeaks(Axis axis, PeakSet peaks, boolean byIndex) {
        for (int i = 0; i < peaks.size(); i++) {
            ReferencePeak peak = peaks.get(i);
            if (byIndex) {
                if (peak.location() < 0 || peak.location() > axis.size() - 1) {
                    throw new InvalidPeakSetException("peak " + i + " index " + peak.location()
                            + " outside [0, " + (axis.size() - 1) + "]");
                }
            } else if (!axis.contains(peak.location())) {
                throw new InvalidPeakSetException("peak " + i + " at " + peak.location()
                        + " outside axis range [" + axis.first() + ", " + axis.last() + "]");
            }
        }
    }

    private record CachedResult(Signal signal, AlignmentResult result) {}
}
