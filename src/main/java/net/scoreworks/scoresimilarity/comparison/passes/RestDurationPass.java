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
import net.scoreworks.scoresimilarity.model.EventKind;
import net.scoreworks.scoresimilarity.model.Rest;

import java.util.ArrayList;
import java.util.List;


/**
 * Pairs each unresolved rest with the first unresolved rest of a different duration. Only the partner is removed:
 * the rest itself stays unresolved and is counted again by the {@link ResidualPass}
 */
public class RestDurationPass implements ComparisonPass {

    @Override
    public ComparisonState apply(ComparisonState state) {
        ErrorVector.Builder errors = state.getErrors().toBuilder();
        List<ScoreItem> remainingB = new ArrayList<>(state.getRemainingB());
        for (ScoreItem a : state.getRemainingA()) {
            if (a.getEvent().getKind() != EventKind.REST)
                continue;
            Rest rest = (Rest) a.getEvent();
            ScoreItem match = ComparisonState.removeFirst(remainingB, b -> b.getEvent().getKind() == EventKind.REST
                    && !((Rest) b.getEvent()).getDuration().equals(rest.getDuration()));
            if (match != null)
                errors.increment(ErrorKind.REST_DURATION);
        }
        return state.next(state.getRemainingA(), remainingB, errors.build());
    }
}
