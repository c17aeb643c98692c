/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.model.EventContext;
import net.scoreworks.scoresimilarity.model.Note;

import java.util.Objects;


/**
 * Counts the attribute mismatches of two notes that were paired by pitch
 */
public final class AttributeComparison {

    private AttributeComparison() {}

    /**
     * Notes on different staves only count as {@link ErrorKind#STAFF_ASSIGNMENT}. Otherwise every mismatching
     * attribute adds one to its own counter
     */
    public static void compare(ScoreItem a, ScoreItem b, ErrorVector.Builder errors) {
        if (a.getStaff() != b.getStaff()) {
            errors.increment(ErrorKind.STAFF_ASSIGNMENT);
            return;
        }
        compareAttributes(a, b, errors);
    }

    /**
     * Used for enharmonic pairs. A staff mismatch counts as {@link ErrorKind#STAFF_ASSIGNMENT} and the attributes
     * are compared regardless
     */
    public static void compareAnyStaff(ScoreItem a, ScoreItem b, ErrorVector.Builder errors) {
        if (a.getStaff() != b.getStaff())
            errors.increment(ErrorKind.STAFF_ASSIGNMENT);
        compareAttributes(a, b, errors);
    }

    private static void compareAttributes(ScoreItem a, ScoreItem b, ErrorVector.Builder errors) {
        Note noteA = (Note) a.getEvent();
        Note noteB = (Note) b.getEvent();
        if (!noteA.getDuration().equals(noteB.getDuration()))
            errors.increment(ErrorKind.NOTE_DURATION);
        if (noteA.getStem() != noteB.getStem())
            errors.increment(ErrorKind.STEM_DIRECTION);
        if (!noteA.getBeams().key().equals(noteB.getBeams().key()))
            errors.increment(ErrorKind.BEAMS);
        if (noteA.getTie() != noteB.getTie())
            errors.increment(ErrorKind.TIE);

        EventContext contextA = a.getContext();
        EventContext contextB = b.getContext();
        if (contextA.getClef() != contextB.getClef())
            errors.increment(ErrorKind.CLEF);
        if (!Objects.equals(contextA.getTimeSignatureRatio(), contextB.getTimeSignatureRatio()))
            errors.increment(ErrorKind.TIME_SIGNATURE);
        if (contextA.getKeySharps() != contextB.getKeySharps())
            errors.increment(ErrorKind.KEY_SIGNATURE);
        if (!contextA.getVoice().equals(contextB.getVoice()))
            errors.increment(ErrorKind.VOICE);
    }
}
