/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.engine;

import ai.evacortex.peakalign.core.AlignmentResult;
import ai.evacortex.peakalign.core.Axis;
import ai.evacortex.peakalign.core.PeakSet;
import ai.evacortex.peakalign.core.ReferencePeak;
import ai.evacortex.peakalign.core.Signal;
import ai.evacortex.peakalign.core.Transform;
import ai.evacortex.peakalign.core.exceptions.InvalidSignalException;
import ai.evacortex.peakalign.core.math.ReferenceSynthesizer;
import ai.evacortex.peakalign.core.math.SearchWindow;
import ai.evacortex.peakalign.core.math.WindowExtractor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Coarse-to-fine grid search for the transform that best lines a signal up with the reference peaks.
 *
 * <p>Each round evaluates an evenly spaced grid over the current offset interval (and scale interval,
 * when scale is searched), keeps the best candidate and shrinks every interval around it by
 * {@link AlignmentConfig#ratio()}. The first rounds locate the peaks roughly across the whole
 * shift range; the later ones refine the estimate locally. Total work is bounded by
 * {@code iterations × gridSteps} candidates, squared when scale is searched.</p>
 *
 * <p>A candidate's score is the weight-normalized sum of its per-peak window scores:</p>
 * <pre>
 *     A = Σ wᵢ · Sᵢ / Σ wᵢ
 * </pre>
 * <p>Peaks whose window is clipped below the usable width, or whose score is not finite, add nothing.
 * When no peak yields a finite score the candidate scores {@code -Infinity}.</p>
 *
 * <p>Instances are immutable and safe to share between worker threads.</p>
 */
public final class MultiResolutionSearch {

    private static final Logger LOGGER = LogManager.getFormatterLogger(MultiResolutionSearch.class);

    /** Upper bound of the initial scale half-width around 1. */
    static final double MAX_SCALE_HALF_WIDTH = 0.5;
    /** Synthetic peak width, in mean axis spacings, when none is configured. */
    static final double AUTO_WIDTH_SAMPLES = 4.0;
    static final double TIE_TOLERANCE = 1e-12;

    private final Axis axis;
    private final PeakSet peaks;
    private final AlignmentConfig config;
    private final GridScorer scorer;
    private final double width;
    private final boolean searchScale;
    private final double initialScaleHalfWidth;
    private final double totalWeight;

    /**
     * @param axis   axis the search runs on; the index axis when aligning by index
     * @param peaks  reference peaks expressed on {@code axis}
     * @param config validated options
     * @param scorer window scorer
     */
    public MultiResolutionSearch(Axis axis, PeakSet peaks, AlignmentConfig config, GridScorer scorer) {
        this.axis = Objects.requireNonNull(axis, "axis must not be null");
        this.peaks = Objects.requireNonNull(peaks, "peaks must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");

        this.width = config.hasExplicitWidth() ? config.width() : AUTO_WIDTH_SAMPLES * axis.meanSpacing();
        this.totalWeight = peaks.totalWeight();

        double reach = Math.max(Math.abs(config.shiftMin()), Math.abs(config.shiftMax()));
        double maxPeak = peaks.maxAbsLocation();
        // a single peak cannot pin down a stretch
        this.searchScale = !config.onlyShift() && peaks.size() > 1 && maxPeak > 0.0;
        this.initialScaleHalfWidth = searchScale ? Math.min(MAX_SCALE_HALF_WIDTH, reach / maxPeak) : 0.0;
    }

    public AlignmentResult search(Signal signal) {
        checkSignal(signal);

        double offsetCentre = 0.5 * (config.shiftMin() + config.shiftMax());
        double offsetHalf = 0.5 * (config.shiftMax() - config.shiftMin());
        double scaleCentre = 1.0;
        double scaleHalf = initialScaleHalfWidth;

        Transform anchor = Transform.IDENTITY;
        Transform best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (int round = 0; round < config.iterations(); round++) {
            double[] offsets = grid(offsetCentre, offsetHalf, config.gridSteps());
            double[] scales = searchScale ? grid(scaleCentre, scaleHalf, config.gridSteps()) : new double[]{1.0};

            Transform roundBest = null;
            double roundScore = Double.NEGATIVE_INFINITY;
            for (double scale : scales) {
                if (!(scale > 0.0)) continue;
                for (double offset : offsets) {
                    Transform candidate = new Transform(offset, scale);
                    double score = aggregateScore(signal, candidate);
                    if (roundBest == null || isBetter(score, candidate, roundScore, roundBest, anchor)) {
                        roundBest = candidate;
                        roundScore = score;
                    }
                }
            }

            if (roundBest == null || roundScore == Double.NEGATIVE_INFINITY) {
                if (best == null) {
                    LOGGER.debug("No finite score in the first round, leaving signal unaligned");
                    return AlignmentResult.unaligned(peaks.size());
                }
                break;
            }

            best = roundBest;
            bestScore = roundScore;
            anchor = best;

            offsetCentre = best.offset();
            offsetHalf /= config.ratio();
            scaleCentre = best.scale();
            scaleHalf /= config.ratio();
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Best transform offset=%.4f scale=%.5f score=%.4f", best.offset(), best.scale(), bestScore);
        }
        return new AlignmentResult(best, bestScore, peakScores(signal, best), true);
    }

    /**
     * Scores every peak window of {@code signal} under {@code transform}.
     *
     * @return one score per peak, {@code NaN} for peaks whose window was clipped below the usable width,
     *         {@code -Infinity} for windows without variance
     */
    public double[] peakScores(Signal signal, Transform transform) {
        checkSignal(signal);
        double[] scores = new double[peaks.size()];
        for (int k = 0; k < peaks.size(); k++) {
            ReferencePeak peak = peaks.get(k);
            double location = transform.toSignalCoordinate(peak.location());
            SearchWindow window = WindowExtractor.extract(axis, location, config.resolution(), config.alignByIndex());
            if (!window.isUsable()) {
                scores[k] = Double.NaN;
                continue;
            }
            double[] observed = signal.slice(window.lo(), window.hi());
            if (isFlat(observed)) {
                scores[k] = Double.NEGATIVE_INFINITY;
                continue;
            }
            double[] template = ReferenceSynthesizer.synthesize(axis.slice(window), peaks, transform, width);
            scores[k] = scorer.score(observed, template);
        }
        return scores;
    }

    public double aggregateScore(Signal signal, Transform transform) {
        double[] scores = peakScores(signal, transform);
        double sum = 0.0;
        boolean any = false;
        for (int k = 0; k < scores.length; k++) {
            if (!Double.isFinite(scores[k])) continue;
            sum += peaks.get(k).weight() * scores[k];
            any = true;
        }
        return any ? sum / totalWeight : Double.NEGATIVE_INFINITY;
    }

    /** Width of the synthetic peaks, in axis units. */
    public double width() {
        return width;
    }

    public boolean searchesScale() {
        return searchScale;
    }

    double initialScaleHalfWidth() {
        return initialScaleHalfWidth;
    }

    /** {@code steps} evenly spaced values across {@code [centre - half, centre + half]}, ends included. */
    static double[] grid(double centre, double half, int steps) {
        if (steps == 1 || half == 0.0) {
            return new double[]{centre};
        }
        double[] values = new double[steps];
        double lo = centre - half;
        double step = 2.0 * half / (steps - 1);
        for (int i = 0; i < steps; i++) {
            values[i] = lo + i * step;
        }
        return values;
    }

    // ties go to the candidate nearest the previous round's winner: offset first, then scale
    private static boolean isBetter(double score, Transform candidate,
                                    double currentScore, Transform current, Transform anchor) {
        if (score > currentScore + TIE_TOLERANCE) return true;
        if (score < currentScore - TIE_TOLERANCE) return false;

        double dOffset = Math.abs(candidate.offset() - anchor.offset());
        double dOffsetCurrent = Math.abs(current.offset() - anchor.offset());
        if (dOffset != dOffsetCurrent) return dOffset < dOffsetCurrent;
        return Math.abs(candidate.scale() - anchor.scale()) < Math.abs(current.scale() - anchor.scale());
    }

    // a constant window carries no peak shape, whatever its level
    private static boolean isFlat(double[] values) {
        double first = values[0];
        for (int i = 1; i < values.length; i++) {
            if (values[i] != first) return false;
        }
        return true;
    }

    private void checkSignal(Signal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        if (signal.size() != axis.size()) {
            throw new InvalidSignalException("signal has " + signal.size() + " samples, axis has " + axis.size());
        }
    }
}
