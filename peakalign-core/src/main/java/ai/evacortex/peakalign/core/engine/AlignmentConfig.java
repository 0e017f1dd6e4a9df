/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.engine;

import ai.evacortex.peakalign.core.exceptions.InvalidAlignmentConfigException;
import ai.evacortex.peakalign.core.math.InterpolationMethod;

/**
 * Options of the alignment engine. Every instance is validated on construction.
 */
public record AlignmentConfig(
        int iterations,                 // coarse-to-fine refinement rounds
        int resolution,                 // window half-width around each peak, in samples
        int gridSteps,                  // candidates per searched dimension and round
        double ratio,                   // interval shrink factor per round
        double shiftMin,                // initial offset interval, lower end
        double shiftMax,                // initial offset interval, upper end
        boolean onlyShift,              // search the offset only, scale stays 1
        boolean alignByIndex,           // peaks are axis indices, offsets are in samples
        InterpolationMethod method,     // resampling kind used by apply
        boolean returnShifts,           // attach the transforms to the aligned batch
        double width,                   // Gaussian width of synthetic peaks in axis units, 0 = derive from spacing
        boolean quickShift              // apply by whole-sample shifts instead of interpolation
) {

    public static final int DEFAULT_ITERATIONS = 5;
    public static final int DEFAULT_RESOLUTION = 10;
    public static final int DEFAULT_GRID_STEPS = 20;
    public static final double DEFAULT_RATIO = 4.0;
    public static final double DEFAULT_SHIFT_MIN = -100.0;
    public static final double DEFAULT_SHIFT_MAX = 100.0;

    public AlignmentConfig {
        if (iterations <= 0) {
            throw new InvalidAlignmentConfigException("'iterations' must be above 0, got " + iterations);
        }
        if (resolution <= 0) {
            throw new InvalidAlignmentConfigException("'resolution' must be above 0, got " + resolution);
        }
        if (gridSteps <= 0) {
            throw new InvalidAlignmentConfigException("'gridSteps' must be above 0, got " + gridSteps);
        }
        if (!(ratio > 1.0) || Double.isInfinite(ratio)) {
            throw new InvalidAlignmentConfigException("'ratio' must be a finite value above 1, got " + ratio);
        }
        if (!Double.isFinite(shiftMin) || !Double.isFinite(shiftMax)) {
            throw new InvalidAlignmentConfigException("'shiftRange' values must be finite");
        }
        if (shiftMin >= shiftMax) {
            throw new InvalidAlignmentConfigException("'shiftRange' must satisfy min < max, got ["
                    + shiftMin + ", " + shiftMax + "]");
        }
        if (method == null) {
            throw new InvalidAlignmentConfigException("'method' must not be null");
        }
        if (!(width >= 0.0) || Double.isInfinite(width)) {
            throw new InvalidAlignmentConfigException("'width' must be a finite value >= 0, got " + width);
        }
        if (quickShift && !onlyShift) {
            throw new InvalidAlignmentConfigException("'quickShift' cannot be combined with rescaling; "
                    + "it moves signals along the axis without interpolation");
        }
        if (quickShift && !alignByIndex) {
            throw new InvalidAlignmentConfigException("'quickShift' requires 'alignByIndex'; "
                    + "whole-sample moves are only meaningful for offsets measured in samples");
        }
    }

    public static AlignmentConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .iterations(iterations)
                .resolution(resolution)
                .gridSteps(gridSteps)
                .ratio(ratio)
                .shiftRange(shiftMin, shiftMax)
                .onlyShift(onlyShift)
                .alignByIndex(alignByIndex)
                .method(method)
                .returnShifts(returnShifts)
                .width(width)
                .quickShift(quickShift);
    }

    public boolean hasExplicitWidth() {
        return width > 0.0;
    }

    public static final class Builder {
        private int iterations = DEFAULT_ITERATIONS;
        private int resolution = DEFAULT_RESOLUTION;
        private int gridSteps = DEFAULT_GRID_STEPS;
        private double ratio = DEFAULT_RATIO;
        private double shiftMin = DEFAULT_SHIFT_MIN;
        private double shiftMax = DEFAULT_SHIFT_MAX;
        private boolean onlyShift = false;
        private boolean alignByIndex = false;
        private InterpolationMethod method = InterpolationMethod.CUBIC;
        private boolean returnShifts = false;
        private double width = 0.0;
        private boolean quickShift = false;

        private Builder() {}

        public Builder iterations(int iterations) { this.iterations = iterations; return this; }
        public Builder resolution(int resolution) { this.resolution = resolution; return this; }
        public Builder gridSteps(int gridSteps) { this.gridSteps = gridSteps; return this; }
        public Builder ratio(double ratio) { this.ratio = ratio; return this; }
        public Builder onlyShift(boolean onlyShift) { this.onlyShift = onlyShift; return this; }
        public Builder alignByIndex(boolean alignByIndex) { this.alignByIndex = alignByIndex; return this; }
        public Builder method(InterpolationMethod method) { this.method = method; return this; }
        public Builder returnShifts(boolean returnShifts) { this.returnShifts = returnShifts; return this; }
        public Builder width(double width) { this.width = width; return this; }
        public Builder quickShift(boolean quickShift) { this.quickShift = quickShift; return this; }

        public Builder shiftRange(double min, double max) {
            this.shiftMin = min;
            this.shiftMax = max;
            return this;
        }

        public Builder shiftRange(double[] range) {
            if (range == null || range.length != 2) {
                throw new InvalidAlignmentConfigException("'shiftRange' accepts exactly two values");
            }
            return shiftRange(range[0], range[1]);
        }

        public AlignmentConfig build() {
            return new AlignmentConfig(iterations, resolution, gridSteps, ratio, shiftMin, shiftMax,
                    onlyShift, alignByIndex, method, returnShifts, width, quickShift);
        }
    }
}
