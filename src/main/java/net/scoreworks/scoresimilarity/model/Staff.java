/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import net.scoreworks.scoresimilarity.exceptions.MalformedScoreException;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * One event stream of a score, ordered by non-decreasing offset. Index 0 is the top staff, 1 the bottom staff.
 * Entries sharing an offset form a simultaneous set, their order carries no meaning
 */
public final class Staff {
    public static final int TOP = 0;
    public static final int BOTTOM = 1;

    private final int index;
    private final List<StaffEntry> entries;

    public Staff(int index, List<StaffEntry> entries) {
        if (index != TOP && index != BOTTOM)
            throw new MalformedScoreException("staff index must be 0 or 1 but was " + index);
        Fraction previous = Fraction.ZERO;
        for (StaffEntry entry : entries) {
            if (entry == null)
                throw new MalformedScoreException(index, previous, "null entry");
            if (entry.getOffset().compareTo(previous) < 0)
                throw new MalformedScoreException(index, entry.getOffset(), "offset decreases after " + previous);
            previous = entry.getOffset();
        }
        this.index = index;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public int getIndex() {
        return index;
    }

    public List<StaffEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
