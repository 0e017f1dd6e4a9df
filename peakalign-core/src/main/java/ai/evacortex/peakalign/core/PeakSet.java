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

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, non-empty set of {@link ReferencePeak}s. Locations and weights travel together,
 * so there is no separate weight vector to fall out of step with the peaks.
 */
public record PeakSet(List<ReferencePeak> peaks) {

    public PeakSet {
        if (peaks == null || peaks.isEmpty()) {
            throw new InvalidPeakSetException("at least one reference peak is required");
        }
        peaks = List.copyOf(peaks);
    }

    /** Peaks with weight 1 each. */
    public static PeakSet uniform(double... locations) {
        if (locations == null || locations.length == 0) {
            throw new InvalidPeakSetException("at least one reference peak is required");
        }
        List<ReferencePeak> list = new ArrayList<>(locations.length);
        for (double location : locations) {
            list.add(ReferencePeak.at(location));
        }
        return new PeakSet(list);
    }

    /**
     * Pairs parallel location / weight arrays. A {@code null} weight array means uniform weights.
     *
     * @throws InvalidPeakSetException if the arrays differ in length
     */
    public static PeakSet weighted(double[] locations, double[] weights) {
        if (weights == null) {
            return uniform(locations);
        }
        if (locations == null || locations.length != weights.length) {
            throw new InvalidPeakSetException("Number of weights does not match number of peaks");
        }
        List<ReferencePeak> list = new ArrayList<>(locations.length);
        for (int i = 0; i < locations.length; i++) {
            list.add(new ReferencePeak(locations[i], weights[i]));
        }
        return new PeakSet(list);
    }

    public int size() {
        return peaks.size();
    }

    public ReferencePeak get(int index) {
        return peaks.get(index);
    }

    public double[] locations() {
        double[] out = new double[peaks.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = peaks.get(i).location();
        }
        return out;
    }

    public double totalWeight() {
        double sum = 0.0;
        for (ReferencePeak p : peaks) {
            sum += p.weight();
        }
        return sum;
    }

    public double maxAbsLocation() {
        double max = 0.0;
        for (ReferencePeak p : peaks) {
            max = Math.max(max, Math.abs(p.location()));
        }
        return max;
    }
}
