/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import net.scoreworks.scoresimilarity.exceptions.UnsupportedEventKindException;


/**
 * Raw symbol counts of a score, used to normalize error counts
 */
public final class SymbolCounts {
    public static final SymbolCounts NONE = new SymbolCounts(0, 0, 0, 0);

    private final int notes;
    private final int chords;
    private final int chordNotes;
    private final int rests;

    public SymbolCounts(int notes, int chords, int chordNotes, int rests) {
        this.notes = notes;
        this.chords = chords;
        this.chordNotes = chordNotes;
        this.rests = rests;
    }

    public static SymbolCounts of(Score score) {
        int notes = 0, chords = 0, chordNotes = 0, rests = 0;
        for (Staff staff : score.getStaves()) {
            for (StaffEntry entry : staff.getEntries()) {
                switch (entry.getEvent().getKind()) {
                    case NOTE:
                        notes++;
                        break;
                    case CHORD:
                        chords++;
                        chordNotes += ((Chord) entry.getEvent()).size();
                        break;
                    case REST:
                        rests++;
                        break;
                    case BARLINE:
                    case MEASURE_BOUNDARY:
                    case CLEF:
                    case KEY_SIGNATURE:
                    case TIME_SIGNATURE:
                    case VOICE_MARKER:
                        break;
                    default:
                        throw new UnsupportedEventKindException(entry.getEvent().getKind(), "symbol counting");
                }
            }
        }
        return new SymbolCounts(notes, chords, chordNotes, rests);
    }

    /** single notes, not counting notes inside chords */
    public int getNotes() {
        return notes;
    }

    public int getChords() {
        return chords;
    }

    /** sum of the sizes of all chords */
    public int getChordNotes() {
        return chordNotes;
    }

    public int getRests() {
        return rests;
    }

    /**
     * @return the count error kinds of the given class are normalized by
     */
    public int get(SymbolClass symbolClass) {
        switch (symbolClass) {
            case NOTE:
                return notes + chordNotes;
            case REST:
                return rests;
            default:
                throw new IllegalArgumentException("unknown symbol class " + symbolClass);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SymbolCounts))
            return false;
        SymbolCounts other = (SymbolCounts) o;
        return notes == other.notes && chords == other.chords && chordNotes == other.chordNotes && rests == other.rests;
    }

    @Override
    public int hashCode() {
        return ((notes * 31 + chords) * 31 + chordNotes) * 31 + rests;
    }

    @Override
    public String toString() {
        return "notes=" + notes + ", chords=" + chords + ", chordNotes=" + chordNotes + ", rests=" + rests;
    }
}
