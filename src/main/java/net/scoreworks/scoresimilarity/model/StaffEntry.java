/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.apache.commons.lang3.math.Fraction;
import org.jetbrains.annotations.NotNull;

/**
 * An event at its absolute offset within the score, with the context it was written in
 */
public final class StaffEntry {
    private final Fraction offset;
    private final Event event;
    private final EventContext context;

    public StaffEntry(@NotNull Fraction offset, @NotNull Event event, @NotNull EventContext context) {
        this.offset = offset.reduce();
        this.event = event;
        this.context = context;
    }

    public Fraction getOffset() {
        return offset;
    }

    public Event getEvent() {
        return event;
    }

    public EventContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return Durations.format(offset) + ": " + event;
    }
}
