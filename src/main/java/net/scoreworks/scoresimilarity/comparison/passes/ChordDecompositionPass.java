/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison.passes;

import net.scoreworks.scoresimilarity.comparison.ComparisonPass;
import net.scoreworks.scoresimilarity.comparison.ComparisonState;
import net.scoreworks.scoresimilarity.comparison.ScoreItem;
import net.scoreworks.scoresimilarity.model.Chord;
import net.scoreworks.scoresimilarity.model.EventKind;
import net.scoreworks.scoresimilarity.model.Note;

import java.util.ArrayList;
import java.util.List;


/**
 * Splits every unresolved chord of either side into one note per pitch, so that the following passes can pair
 * chord members individually. Decomposed notes keep staff, offset and context of their chord
 */
public class ChordDecompositionPass implements ComparisonPass {

    @Override
    public ComparisonState apply(ComparisonState state) {
        List<ScoreItem> remainingA = new ArrayList<>();
        List<ScoreItem> remainingB = new ArrayList<>();
        int chords = decompose(state.getRemainingA(), remainingA) + decompose(state.getRemainingB(), remainingB);
        return state.next(remainingA, remainingB, state.getErrors()).withDecomposedChords(chords);
    }

    private static int decompose(List<ScoreItem> items, List<ScoreItem> out) {
        int chords = 0;
        for (ScoreItem item : items) {
            if (item.getEvent().getKind() == EventKind.CHORD) {
                chords++;
                for (Note note : ((Chord) item.getEvent()).decompose())
                    out.add(item.withEvent(note));
            }
            else out.add(item);
        }
        return chords;
    }
}
