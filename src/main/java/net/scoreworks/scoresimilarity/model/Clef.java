/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.jetbrains.annotations.NotNull;

public final class Clef extends Event {
    private final ClefKind clefKind;

    public Clef(@NotNull ClefKind clefKind) {
        super(EventKind.CLEF);
        this.clefKind = clefKind;
    }

    public ClefKind getClefKind() {
        return clefKind;
    }

    @Override
    public String toString() {
        return "Clef " + clefKind;
    }
}
