/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.exceptions;

public class InvalidPeakSetException extends RuntimeException {
    public InvalidPeakSetException(String message) {
        super("Invalid peak set: " + message);
    }
}
