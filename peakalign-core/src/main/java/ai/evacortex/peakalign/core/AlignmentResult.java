/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core;

import java.util.Arrays;

/**
 * Outcome of the search for one signal.
 *
 * @param transform  best correction found, {@link Transform#IDENTITY} when not confident
 * @param score      weight-normalized aggregate score of {@code transform}, {@code -Infinity} when not confident
 * @param peakScores per-peak window scores at {@code transform}; skipped peaks are {@code NaN}
 * @param confident  {@code false} when no candidate produced a finite score (e.g. a flat signal)
 */
public record AlignmentResult(Transform transform, double score, double[] peakScores, boolean confident) {

    public AlignmentResult {
        peakScores = peakScores.clone();
    }

    public static AlignmentResult unaligned(int peakCount) {
        double[] scores = new double[peakCount];
        Arrays.fill(scores, Double.NaN);
        return new AlignmentResult(Transform.IDENTITY, Double.NEGATIVE_INFINITY, scores, false);
    }

    @Override
    public double[] peakScores() {
        return peakScores.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AlignmentResult)) return false;
        AlignmentResult other = (AlignmentResult) obj;
        return confident == other.confident
                && Double.compare(score, other.score) == 0
                && transform.equals(other.transform)
                && Arrays.equals(peakScores, other.peakScores);
    }

    @Override
    public int hashCode() {
        int h = transform.hashCode();
        h = 31 * h + Double.hashCode(score);
        h = 31 * h + Arrays.hashCode(peakScores);
        return 31 * h + Boolean.hashCode(confident);
    }

    @Override
    public String toString() {
        return String.format("AlignmentResult[offset=%.4f, scale=%.5f, score=%.4f, confident=%s]",
                transform.offset(), transform.scale(), score, confident);
    }
}
