/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core;

import java.util.List;

/**
 * Aligned signals, row for row, plus the transforms that produced them when they were requested.
 */
public record AlignedBatch(Batch signals, List<Transform> transforms) {

    public AlignedBatch {
        transforms = List.copyOf(transforms);
    }

    public boolean hasTransforms() {
        return !transforms.isEmpty();
    }

    public double[] offsets() {
        double[] out = new double[transforms.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = transforms.get(i).offset();
        }
        return out;
    }

    public double[] scales() {
        double[] out = new double[transforms.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = transforms.get(i).scale();
        }
        return out;
    }
}
