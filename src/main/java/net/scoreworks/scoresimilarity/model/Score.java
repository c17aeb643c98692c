/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import net.scoreworks.scoresimilarity.exceptions.MalformedScoreException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * A piano-style score made of one or two {@link Staff}s
 */
public final class Score {
    private final List<Staff> staves;

    public Score(List<Staff> staves) {
        if (staves == null || staves.isEmpty() || staves.size() > 2)
            throw new MalformedScoreException("a score needs one or two staves but had " + (staves == null ? 0 : staves.size()));
        for (int i = 0; i < staves.size(); i++) {
            if (staves.get(i).getIndex() != i)
                throw new MalformedScoreException("staff at position " + i + " has index " + staves.get(i).getIndex());
        }
        this.staves = Collections.unmodifiableList(new ArrayList<>(staves));
    }

    public static Score of(Staff... staves) {
        return new Score(Arrays.asList(staves));
    }

    public List<Staff> getStaves() {
        return staves;
    }

    public Staff getStaff(int index) {
        return staves.get(index);
    }

    public int getStaffCount() {
        return staves.size();
    }

    public SymbolCounts countSymbols() {
        return SymbolCounts.of(this);
    }
}
