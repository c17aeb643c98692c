/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

/**
 * Tag of the closed set of {@link Event} variants. Every comparison stage switches over this enum exhaustively
 */
public enum EventKind {
    NOTE,
    CHORD,
    REST,
    BARLINE,
    MEASURE_BOUNDARY,
    CLEF,
    KEY_SIGNATURE,
    TIME_SIGNATURE,
    VOICE_MARKER;

    public boolean isPitched() {
        return this == NOTE || this == CHORD;
    }

    public boolean isMeasureMarker() {
        return this == BARLINE || this == MEASURE_BOUNDARY;
    }
}
