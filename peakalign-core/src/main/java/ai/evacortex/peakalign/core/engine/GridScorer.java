/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.engine;

/**
 * {@code GridScorer} rates how well an observed window matches the synthetic template built for one
 * candidate transform. The search ranks candidates by this score, higher is better.
 *
 * <p>Implementations must be deterministic and free of side effects: the same scorer instance is
 * shared by every worker thread of an engine. They must not throw on degenerate but well-formed
 * input. A window or template without energy scores {@link Double#NEGATIVE_INFINITY} so it can
 * never be selected.</p>
 *
 * @see CosineScorer
 * @see MultiResolutionSearch
 */
public interface GridScorer {

    /**
     * Scores one observed window against one template.
     *
     * @param window   observed intensities inside the search window
     * @param template synthetic reference sampled on the same positions
     * @return similarity score, or {@code -Infinity} when either input has zero norm
     * @throws IllegalArgumentException if the lengths differ
     * @throws NullPointerException     if either input is {@code null}
     */
    double score(double[] window, double[] template);
}
