/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.apache.commons.lang3.math.Fraction;
import org.jetbrains.annotations.NotNull;


public final class Note extends Event {
    private final Pitch pitch;
    private final Fraction duration;
    private final StemDirection stem;
    private final Beams beams;
    private final TieState tie;

    public Note(@NotNull Pitch pitch, Fraction duration) {
        this(pitch, duration, StemDirection.UNSPECIFIED, Beams.NONE, TieState.NONE);
    }

    public Note(@NotNull Pitch pitch, Fraction duration, StemDirection stem, Beams beams, TieState tie) {
        super(EventKind.NOTE);
        this.pitch = pitch;
        this.duration = checkDuration(duration);
        this.stem = stem == null ? StemDirection.UNSPECIFIED : stem;
        this.beams = beams == null ? Beams.NONE : beams;
        this.tie = tie == null ? TieState.NONE : tie;
    }

    public Pitch getPitch() {
        return pitch;
    }

    public Fraction getDuration() {
        return duration;
    }

    public StemDirection getStem() {
        return stem;
    }

    public Beams getBeams() {
        return beams;
    }

    public TieState getTie() {
        return tie;
    }

    @Override
    public String toString() {
        return "Note " + pitch + " " + Durations.format(duration);
    }
}
