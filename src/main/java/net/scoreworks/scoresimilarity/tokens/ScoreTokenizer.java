/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.tokens;

import net.scoreworks.scoresimilarity.exceptions.MalformedScoreException;
import net.scoreworks.scoresimilarity.exceptions.UnsupportedEventKindException;
import net.scoreworks.scoresimilarity.model.Beams;
import net.scoreworks.scoresimilarity.model.Chord;
import net.scoreworks.scoresimilarity.model.Clef;
import net.scoreworks.scoresimilarity.model.Event;
import net.scoreworks.scoresimilarity.model.EventKind;
import net.scoreworks.scoresimilarity.model.KeySignature;
import net.scoreworks.scoresimilarity.model.Note;
import net.scoreworks.scoresimilarity.model.Pitch;
import net.scoreworks.scoresimilarity.model.Rest;
import net.scoreworks.scoresimilarity.model.Score;
import net.scoreworks.scoresimilarity.model.Staff;
import net.scoreworks.scoresimilarity.model.StaffEntry;
import net.scoreworks.scoresimilarity.model.StemDirection;
import net.scoreworks.scoresimilarity.model.TieState;
import net.scoreworks.scoresimilarity.model.TimeSignature;
import net.scoreworks.scoresimilarity.model.VoiceMarker;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Encodes a {@link Score} into the {@link TokenVocabulary}. Each measure starts with {@code bar}. Measures with voice
 * markers emit the events of each voice between {@code <voice>} and {@code </voice>}; events before the first voice
 * marker and events of unmarked voices come first
 */
public class ScoreTokenizer {
    private final boolean noteNames;

    public ScoreTokenizer() {
        this(true);
    }

    /**
     * @param noteNames write spelled pitch names ({@code note_C#4}) if true, MIDI numbers ({@code note_61}) if false
     */
    public ScoreTokenizer(boolean noteNames) {
        this.noteNames = noteNames;
    }

    public List<String> tokenize(Score score) {
        List<String> tokens = new ArrayList<>();
        tokens.add(TokenVocabulary.RIGHT_HAND);
        tokens.addAll(tokenize(score.getStaff(Staff.TOP)));
        if (score.getStaffCount() == 2) {
            tokens.add(TokenVocabulary.LEFT_HAND);
            tokens.addAll(tokenize(score.getStaff(Staff.BOTTOM)));
        }
        return tokens;
    }

    public String tokenizeToString(Score score) {
        return String.join(" ", tokenize(score));
    }

    List<String> tokenize(Staff staff) {
        List<String> tokens = new ArrayList<>();
        for (List<StaffEntry> measure : splitMeasures(staff)) {
            tokens.add(TokenVocabulary.BAR);
            if (hasVoices(measure))
                addVoices(measure, tokens);
            else {
                for (StaffEntry entry : measure)
                    addEvent(entry.getEvent(), tokens);
            }
        }
        return tokens;
    }

    /**
     * every measure marker starts a new measure, content before the first marker forms a measure of its own
     */
    private static List<List<StaffEntry>> splitMeasures(Staff staff) {
        List<List<StaffEntry>> measures = new ArrayList<>();
        List<StaffEntry> current = null;
        for (StaffEntry entry : staff.getEntries()) {
            if (entry.getEvent().getKind().isMeasureMarker()) {
                current = new ArrayList<>();
                measures.add(current);
                continue;
            }
            if (current == null) {
                current = new ArrayList<>();
                measures.add(current);
            }
            current.add(entry);
        }
        return measures;
    }

    private static boolean hasVoices(List<StaffEntry> measure) {
        for (StaffEntry entry : measure) {
            if (entry.getEvent().getKind() == EventKind.VOICE_MARKER)
                return true;
        }
        return false;
    }

    private void addVoices(List<StaffEntry> measure, List<String> tokens) {
        Map<String, List<StaffEntry>> voices = new LinkedHashMap<>();
        for (StaffEntry entry : measure) {
            if (entry.getEvent().getKind() == EventKind.VOICE_MARKER)
                voices.putIfAbsent(((VoiceMarker) entry.getEvent()).getId(), new ArrayList<>());
        }
        boolean inVoices = false;
        for (StaffEntry entry : measure) {
            if (entry.getEvent().getKind() == EventKind.VOICE_MARKER) {
                inVoices = true;
                continue;
            }
            List<StaffEntry> voice = voices.get(entry.getContext().getVoice());
            if (inVoices && voice != null)
                voice.add(entry);
            else
                addEvent(entry.getEvent(), tokens);
        }
        for (List<StaffEntry> voice : voices.values()) {
            tokens.add(TokenVocabulary.VOICE_OPEN);
            for (StaffEntry entry : voice)
                addEvent(entry.getEvent(), tokens);
            tokens.add(TokenVocabulary.VOICE_CLOSE);
        }
    }

    private void addEvent(Event event, List<String> tokens) {
        switch (event.getKind()) {
            case NOTE:
                Note note = (Note) event;
                tokens.add(pitch(note.getPitch()));
                addNoteAttributes(note.getDuration(), note.getStem(), note.getBeams(), note.getTie(), tokens);
                break;
            case CHORD:
                Chord chord = (Chord) event;
                for (Pitch pitch : chord.getPitches())
                    tokens.add(pitch(pitch));
                addNoteAttributes(chord.getDuration(), chord.getStem(), chord.getBeams(), chord.getTie(), tokens);
                break;
            case REST:
                tokens.add(TokenVocabulary.REST);
                tokens.add(TokenVocabulary.length(((Rest) event).getDuration()));
                break;
            case CLEF:
                tokens.add(TokenVocabulary.CLEF_PREFIX + ((Clef) event).getClefKind().code());
                break;
            case KEY_SIGNATURE:
                tokens.add(TokenVocabulary.key((KeySignature) event));
                break;
            case TIME_SIGNATURE:
                tokens.add(TokenVocabulary.time((TimeSignature) event));
                break;
            case BARLINE:
            case MEASURE_BOUNDARY:
            case VOICE_MARKER:
                break;
            default:
                throw new UnsupportedEventKindException(event.getKind(), "tokenization");
        }
    }

    private static void addNoteAttributes(Fraction duration, StemDirection stem, Beams beams, TieState tie, List<String> tokens) {
        tokens.add(TokenVocabulary.length(duration));
        if (stem != StemDirection.UNSPECIFIED)
            tokens.add(TokenVocabulary.STEM_PREFIX + stem.code());
        if (!beams.isEmpty())
            tokens.add(TokenVocabulary.BEAM_PREFIX + beams.key());
        if (tie != TieState.NONE)
            tokens.add(TokenVocabulary.TIE_PREFIX + tie.code());
    }

    /**
     * Names below octave 0 would read back with a flat ({@code C-1} is C flat 1), so only MIDI numbers can carry them
     */
    private String pitch(Pitch pitch) {
        if (noteNames && pitch.getOctave() < 0)
            throw new MalformedScoreException("no note name for " + pitch + " below octave 0, tokenize with MIDI numbers");
        if (noteNames)
            return TokenVocabulary.NOTE_PREFIX + pitch;
        return TokenVocabulary.NOTE_PREFIX + pitch.midi();
    }
}
