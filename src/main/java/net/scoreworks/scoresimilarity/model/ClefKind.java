/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

public enum ClefKind {
    TREBLE, BASS, ALTO, TENOR;

    public String code() {
        return name().toLowerCase();
    }

    public static ClefKind fromCode(String code) {
        for (ClefKind kind : values()) {
            if (kind.code().equals(code))
                return kind;
        }
        throw new IllegalArgumentException("unknown clef " + code);
    }
}
