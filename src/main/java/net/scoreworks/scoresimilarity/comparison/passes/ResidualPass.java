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
import net.scoreworks.scoresimilarity.exceptions.UnsupportedEventKindException;
import net.scoreworks.scoresimilarity.model.Chord;
import net.scoreworks.scoresimilarity.model.EventKind;

import java.util.List;


/**
 * Counts everything left unresolved. Leftovers of A (the ground truth) are deletions, leftovers of B (the
 * estimate) are insertions. Structural markers are not counted
 */
public class ResidualPass implements ComparisonPass {

    @Override
    public ComparisonState apply(ComparisonState state) {
        ErrorVector.Builder errors = state.getErrors().toBuilder();
        count(state.getRemainingA(), errors, ErrorKind.NOTE_DELETION, ErrorKind.REST_DELETION);
        count(state.getRemainingB(), errors, ErrorKind.NOTE_INSERTION, ErrorKind.REST_INSERTION);
        return state.next(state.getRemainingA(), state.getRemainingB(), errors.build());
    }

    private static void count(List<ScoreItem> items, ErrorVector.Builder errors, ErrorKind noteKind, ErrorKind restKind) {
        for (ScoreItem item : items) {
            EventKind kind = item.getEvent().getKind();
            switch (kind) {
                case NOTE:
                    errors.increment(noteKind);
                    break;
                case CHORD:
                    errors.add(noteKind, ((Chord) item.getEvent()).size());
                    break;
                case REST:
                    errors.increment(restKind);
                    break;
                case BARLINE:
                case MEASURE_BOUNDARY:
                case CLEF:
                case KEY_SIGNATURE:
                case TIME_SIGNATURE:
                case VOICE_MARKER:
                    break;
                default:
                    throw new UnsupportedEventKindException(kind, "residual counting");
            }
        }
    }
}
