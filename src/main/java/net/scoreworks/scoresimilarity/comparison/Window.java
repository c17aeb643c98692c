/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.model.Durations;
import org.apache.commons.lang3.math.Fraction;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * All items of one score whose offset lies in [start, end). A null end is unbounded
 */
public final class Window {
    private final Fraction start;
    private final Fraction end;
    private final List<ScoreItem> items;

    Window(Fraction start, @Nullable Fraction end, List<ScoreItem> items) {
        this.start = start;
        this.end = end;
        this.items = Collections.unmodifiableList(items);
    }

    /**
     * @param items ordered by offset
     */
    public static Window select(List<ScoreItem> items, Fraction start, @Nullable Fraction end) {
        List<ScoreItem> selected = new ArrayList<>();
        for (ScoreItem item : items) {
            if (end != null && item.getOffset().compareTo(end) >= 0)
                break;
            if (item.getOffset().compareTo(start) >= 0)
                selected.add(item);
        }
        return new Window(start, end, selected);
    }

    public Fraction getStart() {
        return start;
    }

    public @Nullable Fraction getEnd() {
        return end;
    }

    public boolean isUnbounded() {
        return end == null;
    }

    public List<ScoreItem> getItems() {
        return items;
    }

    @Override
    public String toString() {
        return "[" + Durations.format(start) + ", " + (end == null ? "inf" : Durations.format(end)) + ") " + items.size() + " items";
    }
}
