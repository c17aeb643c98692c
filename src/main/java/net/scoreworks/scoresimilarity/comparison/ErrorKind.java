/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.model.SymbolClass;

/**
 * The closed taxonomy of discrepancies between an estimated and a ground truth score. The ordinal is the position
 * of the kind in an {@link ErrorVector}
 */
public enum ErrorKind {
    CLEF("Clef", SymbolClass.NOTE),
    KEY_SIGNATURE("KeySignature", SymbolClass.NOTE),
    TIME_SIGNATURE("TimeSignature", SymbolClass.NOTE),
    NOTE_DELETION("NoteDeletion", SymbolClass.NOTE),
    NOTE_INSERTION("NoteInsertion", SymbolClass.NOTE),
    NOTE_SPELLING("NoteSpelling", SymbolClass.NOTE),
    NOTE_DURATION("NoteDuration", SymbolClass.NOTE),
    STEM_DIRECTION("StemDirection", SymbolClass.NOTE),
    BEAMS("Beams", SymbolClass.NOTE),
    TIE("Tie", SymbolClass.NOTE),
    REST_INSERTION("RestInsertion", SymbolClass.REST),
    REST_DELETION("RestDeletion", SymbolClass.REST),
    REST_DURATION("RestDuration", SymbolClass.REST),
    STAFF_ASSIGNMENT("StaffAssignment", SymbolClass.NOTE),
    VOICE("Voice", SymbolClass.NOTE);

    private final String label;
    private final SymbolClass symbolClass;

    ErrorKind(String label, SymbolClass symbolClass) {
        this.label = label;
        this.symbolClass = symbolClass;
    }

    /** column name used in result tables */
    public String getLabel() {
        return label;
    }

    /** class of ground truth symbols this kind is normalized by */
    public SymbolClass getSymbolClass() {
        return symbolClass;
    }
}
