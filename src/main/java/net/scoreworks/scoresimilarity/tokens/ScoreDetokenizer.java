/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.tokens;

import net.scoreworks.scoresimilarity.exceptions.TokenFormatException;
import net.scoreworks.scoresimilarity.model.Barline;
import net.scoreworks.scoresimilarity.model.Beams;
import net.scoreworks.scoresimilarity.model.Chord;
import net.scoreworks.scoresimilarity.model.Clef;
import net.scoreworks.scoresimilarity.model.ClefKind;
import net.scoreworks.scoresimilarity.model.Durations;
import net.scoreworks.scoresimilarity.model.Event;
import net.scoreworks.scoresimilarity.model.KeySignature;
import net.scoreworks.scoresimilarity.model.Note;
import net.scoreworks.scoresimilarity.model.Pitch;
import net.scoreworks.scoresimilarity.model.Rest;
import net.scoreworks.scoresimilarity.model.Score;
import net.scoreworks.scoresimilarity.model.Staff;
import net.scoreworks.scoresimilarity.model.StaffBuilder;
import net.scoreworks.scoresimilarity.model.StemDirection;
import net.scoreworks.scoresimilarity.model.TieState;
import net.scoreworks.scoresimilarity.model.TimeSignature;
import net.scoreworks.scoresimilarity.model.VoiceMarker;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static net.scoreworks.scoresimilarity.tokens.TokenVocabulary.*;


/**
 * Decodes a token sequence of the {@link TokenVocabulary} into a {@link Score}
 */
public class ScoreDetokenizer {

    public Score detokenize(String text) {
        return detokenize(Arrays.asList(StringUtils.split(StringUtils.defaultString(text))));
    }

    public Score detokenize(List<String> tokens) {
        List<String> expanded = expandConcatenated(tokens);
        int right = expanded.indexOf(RIGHT_HAND);
        if (right < 0)
            throw new TokenFormatException("missing " + RIGHT_HAND + " marker", 0);
        int left = expanded.indexOf(LEFT_HAND);
        if (left >= 0 && left < right)
            throw new TokenFormatException(LEFT_HAND + " marker before " + RIGHT_HAND + " marker", left);
        List<Staff> staves = new ArrayList<>();
        int topEnd = left < 0 ? expanded.size() : left;
        staves.add(new StaffReader(Staff.TOP, expanded, right + 1, topEnd).read());
        if (left >= 0)
            staves.add(new StaffReader(Staff.BOTTOM, expanded, left + 1, expanded.size()).read());
        return new Score(staves);
    }

    /**
     * {@code len_1/2_up_start} and {@code attr_1/2_up_start} become {@code len_1/2 stem_up beam_start}
     */
    static List<String> expandConcatenated(List<String> tokens) {
        List<String> expanded = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            String prefix = token.startsWith(LENGTH_PREFIX) ? LENGTH_PREFIX : token.startsWith(ATTRIBUTE_PREFIX) ? ATTRIBUTE_PREFIX : null;
            if (prefix == null) {
                expanded.add(token);
                continue;
            }
            String[] parts = token.substring(prefix.length()).split("_");
            expanded.add(LENGTH_PREFIX + parts[0]);
            if (parts.length > 1 && !parts[1].isEmpty())
                expanded.add(STEM_PREFIX + parts[1]);
            if (parts.length > 2)
                expanded.add(BEAM_PREFIX + String.join("_", Arrays.copyOfRange(parts, 2, parts.length)));
        }
        return expanded;
    }


    private static final class StaffReader {
        private final List<String> tokens;
        private final int from;
        private final int to;
        private final StaffBuilder builder;

        private Fraction position = Fraction.ZERO;
        private Fraction measureEnd = Fraction.ZERO;
        private int keySharps = 0;
        private Fraction voiceStart = null;
        private Fraction voiceEnd = Fraction.ZERO;
        private int voiceCount = 0;
        private boolean inVoice = false;
        private boolean afterVoices = false;

        StaffReader(int index, List<String> tokens, int from, int to) {
            this.tokens = tokens;
            this.from = from;
            this.to = to;
            this.builder = new StaffBuilder(index);
        }

        Staff read() {
            int i = from;
            while (i < to) {
                String token = tokens.get(i);
                if (token.equals(BAR)) {
                    if (inVoice)
                        throw new TokenFormatException("bar inside an open voice", i);
                    position = Durations.max(measureEnd, position);
                    measureEnd = position;
                    builder.add(position, Barline.regular());
                    voiceStart = null;
                    voiceEnd = position;
                    voiceCount = 0;
                    afterVoices = false;
                    i++;
                }
                else if (token.equals(VOICE_OPEN)) {
                    if (inVoice)
                        throw new TokenFormatException("nested " + VOICE_OPEN, i);
                    if (voiceStart == null)
                        voiceStart = position;
                    position = voiceStart;
                    voiceCount++;
                    builder.add(position, new VoiceMarker(String.valueOf(voiceCount)));
                    inVoice = true;
                    i++;
                }
                else if (token.equals(VOICE_CLOSE)) {
                    if (!inVoice)
                        throw new TokenFormatException(VOICE_CLOSE + " without " + VOICE_OPEN, i);
                    voiceEnd = Durations.max(voiceEnd, position);
                    position = voiceStart;
                    inVoice = false;
                    afterVoices = true;
                    i++;
                }
                else if (token.startsWith(CLEF_PREFIX) || token.startsWith(KEY_PREFIX) || token.startsWith(TIME_PREFIX)) {
                    leaveVoicesIfNeeded();
                    i = readAttribute(i);
                }
                else if (token.startsWith(NOTE_PREFIX) || token.equals(REST)) {
                    leaveVoicesIfNeeded();
                    i = readNoteGroup(i);
                }
                else
                    throw new TokenFormatException("unknown token '" + token + "'", i);
            }
            if (inVoice)
                throw new TokenFormatException("unclosed " + VOICE_OPEN, to);
            return builder.build();
        }

        private void leaveVoicesIfNeeded() {
            if (!afterVoices || inVoice)
                return;
            position = voiceEnd;
            builder.add(position, new VoiceMarker(VoiceMarker.DEFAULT_VOICE));
            afterVoices = false;
        }

        private int readAttribute(int i) {
            String token = tokens.get(i);
            try {
                if (token.startsWith(CLEF_PREFIX))
                    builder.add(position, new Clef(ClefKind.fromCode(value(token, CLEF_PREFIX))));
                else if (token.startsWith(KEY_PREFIX)) {
                    // a natural key directly followed by the actual key is redundant
                    if (i + 1 < to && token.startsWith(KEY_PREFIX + "natural") && tokens.get(i + 1).startsWith(KEY_PREFIX))
                        return i + 1;
                    keySharps = parseKey(value(token, KEY_PREFIX));
                    builder.add(position, new KeySignature(keySharps));
                }
                else
                    builder.add(position, parseTime(value(token, TIME_PREFIX)));
            }
            catch (IllegalArgumentException e) {
                throw new TokenFormatException("malformed attribute '" + token + "'", i, e);
            }
            return i + 1;
        }

        private int readNoteGroup(int i) {
            String first = tokens.get(i);
            boolean rest = first.equals(REST);
            List<Pitch> pitches = new ArrayList<>();
            if (!rest)
                pitches.add(parsePitch(first, i));
            List<Fraction> lengths = new ArrayList<>();
            StemDirection stem = StemDirection.UNSPECIFIED;
            Beams beams = Beams.NONE;
            TieState tie = null;

            int j = i + 1;
            for (; j < to; j++) {
                String token = tokens.get(j);
                try {
                    if (!rest && lengths.isEmpty() && token.startsWith(NOTE_PREFIX))
                        pitches.add(parsePitch(token, j));
                    else if (token.startsWith(LENGTH_PREFIX))
                        lengths.add(parseLength(token, j));
                    else if (token.startsWith(STEM_PREFIX))
                        stem = StemDirection.fromCode(value(token, STEM_PREFIX));
                    else if (token.startsWith(BEAM_PREFIX))
                        beams = Beams.parse(value(token, BEAM_PREFIX));
                    else if (token.startsWith(TIE_PREFIX))
                        tie = TieState.fromCode(value(token, TIE_PREFIX));
                    else
                        break;
                }
                catch (IllegalArgumentException e) {
                    throw new TokenFormatException("malformed token '" + token + "'", j, e);
                }
            }
            if (lengths.isEmpty())
                throw new TokenFormatException("missing " + LENGTH_PREFIX + " after '" + first + "'", i);

            for (int k = 0; k < lengths.size(); k++) {
                Fraction length = lengths.get(k);
                Event event;
                if (rest)
                    event = new Rest(length);
                else {
                    TieState state = chainState(tie, k, lengths.size());
                    if (pitches.size() == 1)
                        event = new Note(pitches.get(0), length, stem, beams, state);
                    else
                        event = new Chord(Chord.tonesOf(pitches), length, stem, beams, state);
                }
                builder.add(position, event);
                position = position.add(length);
            }
            measureEnd = Durations.max(measureEnd, position);
            return j;
        }

        private Pitch parsePitch(String token, int index) {
            String name = value(token, NOTE_PREFIX);
            try {
                if (StringUtils.isNumeric(name))
                    return Pitch.fromMidi(Integer.parseInt(name), keySharps);
                return Pitch.parse(name);
            }
            catch (IllegalArgumentException e) {
                throw new TokenFormatException("malformed pitch '" + token + "'", index, e);
            }
        }

        private static Fraction parseLength(String token, int index) {
            Fraction length;
            try {
                length = Durations.parse(value(token, LENGTH_PREFIX));
            }
            catch (NumberFormatException | ArithmeticException e) {
                throw new TokenFormatException("malformed length '" + token + "'", index, e);
            }
            if (length.compareTo(Fraction.ZERO) <= 0)
                throw new TokenFormatException("non-positive length '" + token + "'", index);
            return length;
        }
    }

    /**
     * several lengths on one symbol form a tied chain, an explicit tie keeps every link open
     */
    static TieState chainState(TieState explicit, int link, int links) {
        if (links == 1)
            return explicit == null ? TieState.NONE : explicit;
        if (explicit != null)
            return TieState.CONTINUE;
        if (link == 0)
            return TieState.START;
        return link == links - 1 ? TieState.STOP : TieState.CONTINUE;
    }

    /**
     * @param value {@code sharp_2}, {@code flat_3} or {@code natural_0}
     */
    static int parseKey(String value) {
        String[] parts = value.split("_");
        if (parts.length != 2)
            throw new IllegalArgumentException("not a key: " + value);
        int count = Integer.parseInt(parts[1]);
        switch (parts[0]) {
            case "sharp":
                return count;
            case "flat":
                return -count;
            case "natural":
                return 0;
            default:
                throw new IllegalArgumentException("not a key: " + value);
        }
    }

    /**
     * @param value {@code 3/4} or the shorthand {@code N}, read as N/4 below 6 and N/8 otherwise
     */
    static TimeSignature parseTime(String value) {
        int slash = value.indexOf('/');
        if (slash < 0) {
            int numerator = Integer.parseInt(value);
            return new TimeSignature(numerator, numerator < 6 ? 4 : 8);
        }
        return new TimeSignature(Integer.parseInt(value.substring(0, slash)), Integer.parseInt(value.substring(slash + 1)));
    }
}
