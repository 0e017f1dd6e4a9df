/*
 * PeakAlign — Reference-Peak Signal Alignment Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.peakalign.core.math;

import ai.evacortex.peakalign.core.exceptions.InvalidAlignmentConfigException;

import java.util.Arrays;

/**
 * Interpolation kinds available for resampling. Names are matched exactly, lower case;
 * {@code slinear} is accepted as another name for the linear spline.
 */
public enum InterpolationMethod {
    LINEAR("linear", "slinear"),
    PCHIP("pchip"),
    CUBIC("cubic"),
    ZERO("zero");

    private final String id;
    private final String[] aliases;

    InterpolationMethod(String id, String... aliases) {
        this.id = id;
        this.aliases = aliases;
    }

    public String id() {
        return id;
    }

    public static InterpolationMethod fromName(String name) {
        for (InterpolationMethod m : values()) {
            if (m.id.equals(name)) return m;
            for (String alias : m.aliases) {
                if (alias.equals(name)) return m;
            }
        }
        throw new InvalidAlignmentConfigException("Method '" + name + "' not found in the method options: "
                + Arrays.toString(ids()));
    }

    private static String[] ids() {
        InterpolationMethod[] all = values();
        String[] out = new String[all.length];
        for (int i = 0; i < all.length; i++) out[i] = all[i].id;
        return out;
    }
}
