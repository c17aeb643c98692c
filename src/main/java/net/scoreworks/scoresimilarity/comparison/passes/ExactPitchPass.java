/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison.passes;

import net.scoreworks.scoresimilarity.comparison.AttributeComparison;
import net.scoreworks.scoresimilarity.comparison.ComparisonPass;
import net.scoreworks.scoresimilarity.comparison.ComparisonState;
import net.scoreworks.scoresimilarity.comparison.ErrorVector;
import net.scoreworks.scoresimilarity.comparison.ScoreItem;
import net.scoreworks.scoresimilarity.model.EventKind;
import net.scoreworks.scoresimilarity.model.Note;

import java.util.ArrayList;
import java.util.List;


/**
 * Pairs each unresolved note with the first unresolved note of identical spelled pitch on any staff and counts
 * their attribute mismatches. Paired notes are removed whatever their mismatches
 */
public class ExactPitchPass implements ComparisonPass {

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
            ScoreItem match = ComparisonState.removeFirst(remainingB, b -> b.getEvent().getKind() == EventKind.NOTE
                    && ((Note) b.getEvent()).getPitch().equals(note.getPitch()));
            if (match != null)
                AttributeComparison.compare(a, match, errors);
            else
                remainingA.add(a);
        }
        return state.next(remainingA, remainingB, errors.build());
    }
}
