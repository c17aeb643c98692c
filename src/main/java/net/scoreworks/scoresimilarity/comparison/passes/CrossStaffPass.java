/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison.passes;

import net.scoreworks.scoresimilarity.comparison.ComparisonPass;
import net.scoreworks.scoresimilarity.comparison.ComparisonState;
import net.scoreworks.scoresimilarity.comparison.ErrorKind;
import net.scoreworks.scoresimilarity.comparison.ErrorVector;
import net.scoreworks.scoresimilarity.comparison.ScoreItem;
import net.scoreworks.scoresimilarity.comparison.StructuralEquality;

import java.util.ArrayList;
import java.util.List;


/**
 * Pairs items that are structurally equal but were put on the other staff
 */
public class CrossStaffPass implements ComparisonPass {

    @Override
    public ComparisonState apply(ComparisonState state) {
        ErrorVector.Builder errors = state.getErrors().toBuilder();
        List<ScoreItem> remainingA = new ArrayList<>();
        List<ScoreItem> remainingB = new ArrayList<>(state.getRemainingB());
        for (ScoreItem a : state.getRemainingA()) {
            ScoreItem match = ComparisonState.removeFirst(remainingB,
                    b -> b.getStaff() != a.getStaff() && StructuralEquality.equal(a.getEvent(), b.getEvent()));
            if (match != null)
                errors.increment(ErrorKind.STAFF_ASSIGNMENT);
            else
                remainingA.add(a);
        }
        return state.next(remainingA, remainingB, errors.build());
    }
}
