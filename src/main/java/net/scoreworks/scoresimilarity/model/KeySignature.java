/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

public final class KeySignature extends Event {
    /** number of sharps, negative for flats */
    private final int sharps;

    public KeySignature(int sharps) {
        super(EventKind.KEY_SIGNATURE);
        if (sharps < -7 || sharps > 7)
            throw new IllegalArgumentException("key signature out of range: " + sharps);
        this.sharps = sharps;
    }

    public int getSharps() {
        return sharps;
    }

    @Override
    public String toString() {
        return "KeySignature " + sharps;
    }
}
