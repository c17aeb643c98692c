/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

public enum StemDirection {
    UP, DOWN, UNSPECIFIED;

    public String code() {
        return name().toLowerCase();
    }

    /**
     * @return the direction named by code, {@link #UNSPECIFIED} for anything else (e.g. "none" or "double")
     */
    public static StemDirection fromCode(String code) {
        if ("up".equals(code))
            return UP;
        if ("down".equals(code))
            return DOWN;
        return UNSPECIFIED;
    }
}
