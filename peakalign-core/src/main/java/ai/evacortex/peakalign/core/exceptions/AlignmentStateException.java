/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.exceptions;

/**
 * Thrown when an operation is invoked in an engine state that does not support it,
 * e.g. applying an alignment that has not been estimated.
 */
public class AlignmentStateException extends RuntimeException {

    public AlignmentStateException(String message) {
        super(message);
    }
}
