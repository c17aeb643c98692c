/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

/**
 * Structural marker between measures. A {@link EventKind#MEASURE_BOUNDARY} stands for the start of a measure that
 * has no drawn barline
 */
public final class Barline extends Event {

    private Barline(EventKind kind) {
        super(kind);
    }

    public static Barline regular() {
        return new Barline(EventKind.BARLINE);
    }

    public static Barline measureBoundary() {
        return new Barline(EventKind.MEASURE_BOUNDARY);
    }

    @Override
    public String toString() {
        return getKind() == EventKind.BARLINE ? "Barline" : "MeasureBoundary";
    }
}
