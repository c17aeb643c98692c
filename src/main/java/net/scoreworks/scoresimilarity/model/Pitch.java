/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * An immutable spelled pitch. Two pitches are {@link #equals(Object) exactly equal} if their spelling matches and
 * {@link #isEnharmonicWith(Pitch) enharmonically equal} if they sound the same
 */
public final class Pitch {
    private static final Step[] SHARP_STEPS = {Step.C, Step.C, Step.D, Step.D, Step.E, Step.F, Step.F, Step.G, Step.G, Step.A, Step.A, Step.B};
    private static final int[] SHARP_ALTERS = {0, 1, 0, 1, 0, 0, 1, 0, 1, 0, 1, 0};
    private static final Step[] FLAT_STEPS = {Step.C, Step.D, Step.D, Step.E, Step.E, Step.F, Step.G, Step.G, Step.A, Step.A, Step.B, Step.B};
    private static final int[] FLAT_ALTERS = {0, -1, 0, -1, 0, 0, -1, 0, -1, 0, -1, 0};
    private static final Step[] PLAIN_STEPS = {Step.C, Step.C, Step.D, Step.E, Step.E, Step.F, Step.F, Step.G, Step.G, Step.A, Step.B, Step.B};
    private static final int[] PLAIN_ALTERS = {0, 1, 0, -1, 0, 0, 1, 0, 1, 0, -1, 0};
    private static final Pattern NAME = Pattern.compile("([A-G])(#{1,2}|b{1,2}|-{1,2})?(-?\\d+)");

    private final Step step;
    /** chromatic alteration in semitones, -2 (double flat) to +2 (double sharp) */
    private final int alter;
    private final int octave;

    public Pitch(@NotNull Step step, int alter, int octave) {
        if (alter < -2 || alter > 2)
            throw new IllegalArgumentException("alter out of range: " + alter);
        this.step = step;
        this.alter = alter;
        this.octave = octave;
    }

    /**
     * @param name spelled name like {@code C4}, {@code F#5}, {@code Bb3} or {@code E-2}. Flats may be written as
     *             {@code b} or {@code -}
     */
    public static Pitch parse(String name) {
        if (StringUtils.isBlank(name))
            throw new IllegalArgumentException("empty pitch name");
        Matcher matcher = NAME.matcher(name);
        if (!matcher.matches())
            throw new IllegalArgumentException("not a pitch name: " + name);
        String accidental = StringUtils.defaultString(matcher.group(2));
        int alter = accidental.startsWith("#") ? accidental.length() : -accidental.length();
        return new Pitch(Step.fromLetter(name.charAt(0)), alter, Integer.parseInt(matcher.group(3)));
    }

    /**
     * Spell a MIDI number. Sharp keys spell black keys with sharps, flat keys with flats. Without a key signature
     * black keys are spelled C#, Eb, F#, G# and Bb
     */
    public static Pitch fromMidi(int midi, int keySharps) {
        int pitchClass = Math.floorMod(midi, 12);
        int octave = Math.floorDiv(midi, 12) - 1;
        if (keySharps < 0)
            return new Pitch(FLAT_STEPS[pitchClass], FLAT_ALTERS[pitchClass], octave);
        if (keySharps > 0)
            return new Pitch(SHARP_STEPS[pitchClass], SHARP_ALTERS[pitchClass], octave);
        return new Pitch(PLAIN_STEPS[pitchClass], PLAIN_ALTERS[pitchClass], octave);
    }

    public Step getStep() {
        return step;
    }

    public int getAlter() {
        return alter;
    }

    public int getOctave() {
        return octave;
    }

    /**
     * @return sounding value, C4 = 60
     */
    public int midi() {
        return (octave + 1) * 12 + step.getSemitone() + alter;
    }

    public boolean isEnharmonicWith(Pitch other) {
        return other != null && midi() == other.midi();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Pitch))
            return false;
        Pitch other = (Pitch) o;
        return step == other.step && alter == other.alter && octave == other.octave;
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, alter, octave);
    }

    /**
     * @return spelled name with {@code #} for sharps and {@code b} for flats, e.g. {@code Bb3}
     */
    @Override
    public String toString() {
        String accidental = alter >= 0 ? StringUtils.repeat('#', alter) : StringUtils.repeat('b', -alter);
        return step.name() + accidental + octave;
    }
}
