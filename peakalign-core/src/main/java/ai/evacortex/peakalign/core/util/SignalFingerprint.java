/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.util;

import ai.evacortex.peakalign.core.Signal;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;

/**
 * Content fingerprint of a {@link Signal}, used to recognise a signal that was already searched.
 */
public final class SignalFingerprint {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private SignalFingerprint() {}

    public static long of(Signal signal) {
        if (signal == null) {
            throw new NullPointerException("signal must not be null");
        }
        ByteBuffer buffer = ByteBuffer.allocate(signal.size() * Double.BYTES);
        for (int i = 0; i < signal.size(); i++) {
            buffer.putDouble(signal.at(i));
        }
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }
}
