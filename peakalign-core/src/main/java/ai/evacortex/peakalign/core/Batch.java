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

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered rows of equally sized signals. Row {@code i} of any result derived from a batch
 * corresponds to row {@code i} of the batch.
 */
public record Batch(List<Signal> rows) {

    public Batch {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidSignalException("batch must contain at least one signal");
        }
        rows = List.copyOf(rows);
        int width = rows.get(0).size();
        for (int i = 1; i < rows.size(); i++) {
            if (rows.get(i).size() != width) {
                throw new InvalidSignalException("row " + i + " has " + rows.get(i).size()
                        + " samples, expected " + width);
            }
        }
    }

    public static Batch of(double[]... rows) {
        if (rows == null) {
            throw new InvalidSignalException("batch must not be null");
        }
        List<Signal> signals = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            signals.add(new Signal(row));
        }
        return new Batch(signals);
    }

    public int size() {
        return rows.size();
    }

    /** Number of samples per row. */
    public int width() {
        return rows.get(0).size();
    }

    public Signal row(int index) {
        return rows.get(index);
    }

    public double[][] toArray() {
        double[][] out = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            out[i] = rows.get(i).intensities();
        }
        return out;
    }
}
