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
import ai.evacortex.peakalign.core.Batch;
import ai.evacortex.peakalign.core.Signal;
import ai.evacortex.peakalign.core.Transform;
import ai.evacortex.peakalign.core.exceptions.AlignmentStateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-row alignment results of one {@link AlignmentEngine#estimate(Batch)} call.
 *
 * <p>Holding an {@code EstimatedAlignment} is what makes {@link #apply(Batch)} legal: it only
 * exists once every row has been searched, and its results never change afterwards.</p>
 */
public final class EstimatedAlignment {

    private final AlignmentEngine engine;
    private final List<AlignmentResult> results;

    EstimatedAlignment(AlignmentEngine engine, List<AlignmentResult> results) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.results = List.copyOf(results);
    }

    public int size() {
        return results.size();
    }

    public AlignmentResult result(int row) {
        return results.get(row);
    }

    public List<AlignmentResult> results() {
        return results;
    }

    public List<Transform> transforms() {
        List<Transform> out = new ArrayList<>(results.size());
        for (AlignmentResult r : results) {
            out.add(r.transform());
        }
        return out;
    }

    public long unconfidentCount() {
        return results.stream().filter(r -> !r.confident()).count();
    }

    /**
     * Resamples every row of {@code batch} with the transform estimated for the same row.
     *
     * @param batch the batch that was estimated, or one with the same row layout
     * @return the aligned rows; transforms are attached when {@link AlignmentConfig#returnShifts()} is set
     * @throws AlignmentStateException if the row count differs from the estimate
     */
    public AlignedBatch apply(Batch batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        if (batch.size() != results.size()) {
            throw new AlignmentStateException("Batch has " + batch.size() + " rows but "
                    + results.size() + " were estimated");
        }

        List<Signal> aligned = engine.realignRows(batch, this);
        List<Transform> transforms = engine.config().returnShifts() ? transforms() : List.of();
        return new AlignedBatch(new Batch(aligned), transforms);
    }
}
