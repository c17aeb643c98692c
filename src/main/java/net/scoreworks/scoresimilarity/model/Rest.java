/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.apache.commons.lang3.math.Fraction;


public final class Rest extends Event {
    private final Fraction duration;

    public Rest(Fraction duration) {
        super(EventKind.REST);
        this.duration = checkDuration(duration);
    }

    public Fraction getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "Rest " + Durations.format(duration);
    }
}
