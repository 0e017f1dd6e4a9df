/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.exceptions;

public class InvalidAlignmentConfigException extends RuntimeException {
    public InvalidAlignmentConfigException(String message) {
        super("Invalid alignment configuration: " + message);
    }

    public InvalidAlignmentConfigException(String message, Throwable cause) {
        super("Invalid alignment configuration: " + message, cause);
    }
}
