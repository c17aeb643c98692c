/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

public enum TieState {
    NONE, START, STOP, CONTINUE;

    public String code() {
        return this == NONE ? "" : name().toLowerCase();
    }

    public static TieState fromCode(String code) {
        for (TieState state : values()) {
            if (state != NONE && state.code().equals(code))
                return state;
        }
        throw new IllegalArgumentException("unknown tie type " + code);
    }
}
