/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison.passes;

import net.scoreworks.scoresimilarity.comparison.AttributeComparison;
import net.scoreworks.scoresimilarity.comparison.ComparisonPass;
import net.scoreworks.scoresimilarity.comparison.ComparisonState;
import net.scoreworks.scoresimilarity.comparison.ErrorKind;
import net.scoreworks.scoresimilarity.comparison.ErrorVector;
import net.scoreworks.scoresimilarity.comparison.ScoreItem;
import net.scoreworks.scoresimilarity.model.EventKind;
import net.scoreworks.scoresimilarity.model.Note;

import java.util.ArrayList;
import java.util.List;


/**
 * Pairs each unresolved note with the first unresolved note that sounds the same but is spelled differently.
 * Counts a spelling error plus the attribute mismatches of the pair. A pair on different staves also counts a staff
 * assignment error
 */
public class EnharmonicPass implements ComparisonPass {

    @Override
    public ComparisonState apply(ComparisonState state) {
        ErrorVector.Builder errors = state.getErrors().toBuilder();
        List<ScoreItem> remainingA = new ArrayList<>();
        List<ScoreItem> remainingB = new ArrayList<>(state.getRemainingB());
        for (ScoreItem a : state.getRemainingA()) {
            if (a.getEvent().getKind() != EventKind.NOTE) {
                remainingA.add(a);
                continue;
            }
            Note note = (Note) a.getEvent();
            ScoreItem match = ComparisonState.removeFirst(remainingB, b -> {
                if (b.getEvent().getKind() != EventKind.NOTE)
                    return false;
                Note other = (Note) b.getEvent();
                return other.getPitch().isEnharmonicWith(note.getPitch()) && !other.getPitch().equals(note.getPitch());
            });
            if (match != null) {
                AttributeComparison.compareAnyStaff(a, match, errors);
                errors.increment(ErrorKind.NOTE_SPELLING);
            }
            else remainingA.add(a);
        }
        return state.next(remainingA, remainingB, errors.build());
    }
}
