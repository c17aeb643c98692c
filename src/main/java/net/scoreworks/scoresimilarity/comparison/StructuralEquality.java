/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.exceptions.UnsupportedEventKindException;
import net.scoreworks.scoresimilarity.model.Chord;
import net.scoreworks.scoresimilarity.model.Clef;
import net.scoreworks.scoresimilarity.model.Event;
import net.scoreworks.scoresimilarity.model.EventKind;
import net.scoreworks.scoresimilarity.model.KeySignature;
import net.scoreworks.scoresimilarity.model.Note;
import net.scoreworks.scoresimilarity.model.Rest;
import net.scoreworks.scoresimilarity.model.TimeSignature;
import net.scoreworks.scoresimilarity.model.VoiceMarker;


/**
 * Deep structural equality of two events, independent of staff and offset:
 * <ul>
 *     <li>barlines and measure boundaries always match each other</li>
 *     <li>clefs match if of the same kind, voice markers if of the same id</li>
 *     <li>key signatures match on their number of sharps, time signatures on numerator/beatUnit</li>
 *     <li>notes match on spelled pitch, duration and stem direction</li>
 *     <li>chords match on duration and set of spelled pitches</li>
 *     <li>rests match on duration</li>
 * </ul>
 * Events of different kinds never match otherwise. Beams, ties and context are left for the attribute comparison
 */
public final class StructuralEquality {

    private StructuralEquality() {}

    public static boolean equal(Event a, Event b) {
        EventKind kind = a.getKind();
        switch (kind) {
            case BARLINE:
            case MEASURE_BOUNDARY:
                return b.getKind().isMeasureMarker();
            case CLEF:
                return b.getKind() == EventKind.CLEF && ((Clef) a).getClefKind() == ((Clef) b).getClefKind();
            case KEY_SIGNATURE:
                return b.getKind() == EventKind.KEY_SIGNATURE && ((KeySignature) a).getSharps() == ((KeySignature) b).getSharps();
            case TIME_SIGNATURE:
                return b.getKind() == EventKind.TIME_SIGNATURE && ((TimeSignature) a).ratio().equals(((TimeSignature) b).ratio());
            case VOICE_MARKER:
                return b.getKind() == EventKind.VOICE_MARKER && ((VoiceMarker) a).getId().equals(((VoiceMarker) b).getId());
            case NOTE:
                if (b.getKind() != EventKind.NOTE)
                    return false;
                Note noteA = (Note) a;
                Note noteB = (Note) b;
                return noteA.getPitch().equals(noteB.getPitch())
                        && noteA.getDuration().equals(noteB.getDuration())
                        && noteA.getStem() == noteB.getStem();
            case CHORD:
                if (b.getKind() != EventKind.CHORD)
                    return false;
                Chord chordA = (Chord) a;
                Chord chordB = (Chord) b;
                return chordA.getDuration().equals(chordB.getDuration()) && chordA.getPitchSet().equals(chordB.getPitchSet());
            case REST:
                return b.getKind() == EventKind.REST && ((Rest) a).getDuration().equals(((Rest) b).getDuration());
            default:
                throw new UnsupportedEventKindException(kind, "structural equality");
        }
    }
}
