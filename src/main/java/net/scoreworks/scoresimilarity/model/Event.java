/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import net.scoreworks.scoresimilarity.exceptions.MalformedScoreException;
import org.apache.commons.lang3.math.Fraction;


/**
 * The atomic timed unit on a staff. The set of variants is closed (constructor is package-private), each variant is
 * tagged with its {@link EventKind}. Events are immutable and compared by identity; structural comparison is done
 * by the comparison stages
 */
public abstract class Event {
    private final EventKind kind;

    Event(EventKind kind) {
        this.kind = kind;
    }

    public EventKind getKind() {
        return kind;
    }

    static Fraction checkDuration(Fraction duration) {
        if (duration == null)
            throw new MalformedScoreException("missing duration");
        if (duration.compareTo(Fraction.ZERO) < 0)
            throw new MalformedScoreException("negative duration " + duration);
        return duration.reduce();
    }
}
