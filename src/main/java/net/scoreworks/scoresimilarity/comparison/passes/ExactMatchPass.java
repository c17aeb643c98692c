/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison.passes;

import net.scoreworks.scoresimilarity.comparison.ComparisonPass;
import net.scoreworks.scoresimilarity.comparison.ComparisonState;
import net.scoreworks.scoresimilarity.comparison.ScoreItem;
import net.scoreworks.scoresimilarity.comparison.StructuralEquality;

import java.util.ArrayList;
import java.util.List;


/**
 * Removes every pair of structurally equal items on the same staff
 */
public class ExactMatchPass implements ComparisonPass {

    @Override
    public ComparisonState apply(ComparisonState state) {
        List<ScoreItem> remainingA = new ArrayList<>();
        List<ScoreItem> remainingB = new ArrayList<>(state.getRemainingB());
        for (ScoreItem a : state.getRemainingA()) {
            ScoreItem match = ComparisonState.removeFirst(remainingB,
                    b -> b.getStaff() == a.getStaff() && StructuralEquality.equal(a.getEvent(), b.getEvent()));
            if (match == null)
                remainingA.add(a);
        }
        return state.next(remainingA, remainingB, state.getErrors());
    }
}
