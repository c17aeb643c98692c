/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

/**
 * Descriptor of one beam level of a note
 */
public enum BeamType {
    START("start"),
    STOP("stop"),
    CONTINUE("continue"),
    PARTIAL_LEFT("partial-left"),
    PARTIAL_RIGHT("partial-right");

    private final String code;

    BeamType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static BeamType fromCode(String code) {
        for (BeamType type : values()) {
            if (type.code.equals(code))
                return type;
        }
        throw new IllegalArgumentException("unknown beam type " + code);
    }
}
