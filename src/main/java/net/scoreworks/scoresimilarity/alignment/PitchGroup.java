/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.alignment;

import org.apache.commons.collections4.Bag;
import org.apache.commons.collections4.bag.HashBag;
import org.apache.commons.collections4.bag.UnmodifiableBag;
import org.apache.commons.lang3.math.Fraction;


/**
 * All sounding pitches (MIDI numbers) starting at one offset, across both staves. Spelling is ignored
 */
public final class PitchGroup {
    private final Fraction offset;
    private final Bag<Integer> pitches;

    PitchGroup(Fraction offset, HashBag<Integer> pitches) {
        this.offset = offset;
        this.pitches = UnmodifiableBag.unmodifiableBag(pitches);
    }

    public Fraction getOffset() {
        return offset;
    }

    public Bag<Integer> getPitches() {
        return pitches;
    }

    /**
     * @return size of the multiset symmetric difference: pitches of either group that have no partner in the other
     * group, counted once per occurrence
     */
    public int mismatches(PitchGroup other) {
        int matched = 0;
        for (Integer pitch : pitches.uniqueSet())
            matched += Math.min(pitches.getCount(pitch), other.pitches.getCount(pitch));
        return pitches.size() + other.pitches.size() - 2 * matched;
    }

    @Override
    public String toString() {
        return offset + " " + pitches;
    }
}
