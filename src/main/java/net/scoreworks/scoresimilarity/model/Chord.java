/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import net.scoreworks.scoresimilarity.exceptions.MalformedScoreException;
import org.apache.commons.lang3.math.Fraction;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;


/**
 * A bundle of simultaneous pitches sharing duration, stem, beams and tie. A single {@link Tone} may override the
 * stem direction or tie state of the chord
 */
public final class Chord extends Event {
    private final List<Tone> tones;
    private final Fraction duration;
    private final StemDirection stem;
    private final Beams beams;
    private final TieState tie;

    public Chord(List<Pitch> pitches, Fraction duration) {
        this(tonesOf(pitches), duration, StemDirection.UNSPECIFIED, Beams.NONE, TieState.NONE);
    }

    public Chord(List<Tone> tones, Fraction duration, StemDirection stem, Beams beams, TieState tie) {
        super(EventKind.CHORD);
        if (tones == null || tones.isEmpty())
            throw new MalformedScoreException("chord without pitches");
        this.tones = Collections.unmodifiableList(new ArrayList<>(tones));
        this.duration = checkDuration(duration);
        this.stem = stem == null ? StemDirection.UNSPECIFIED : stem;
        this.beams = beams == null ? Beams.NONE : beams;
        this.tie = tie == null ? TieState.NONE : tie;
    }

    public static List<Tone> tonesOf(List<Pitch> pitches) {
        List<Tone> tones = new ArrayList<>();
        for (Pitch pitch : pitches)
            tones.add(new Tone(pitch));
        return tones;
    }

    public List<Tone> getTones() {
        return tones;
    }

    public List<Pitch> getPitches() {
        List<Pitch> pitches = new ArrayList<>();
        for (Tone tone : tones)
            pitches.add(tone.pitch);
        return pitches;
    }

    /**
     * @return spelled pitches as an ordered set, duplicates removed
     */
    public Set<Pitch> getPitchSet() {
        return new LinkedHashSet<>(getPitches());
    }

    public int size() {
        return tones.size();
    }

    public Fraction getDuration() {
        return duration;
    }

    public StemDirection getStem() {
        return stem;
    }

    public Beams getBeams() {
        return beams;
    }

    public TieState getTie() {
        return tie;
    }

    /**
     * Split into one {@link Note} per tone. Notes inherit duration and beams of the chord, and its stem and tie
     * unless the tone overrides them
     */
    public List<Note> decompose() {
        List<Note> notes = new ArrayList<>();
        for (Tone tone : tones) {
            StemDirection noteStem = tone.stem == StemDirection.UNSPECIFIED ? stem : tone.stem;
            TieState noteTie = tone.tie == null ? tie : tone.tie;
            notes.add(new Note(tone.pitch, duration, noteStem, beams, noteTie));
        }
        return notes;
    }

    @Override
    public String toString() {
        return "Chord " + getPitches() + " " + Durations.format(duration);
    }

    /**
     * One pitch of a chord with optional per-pitch overrides
     */
    public static final class Tone {
        private final Pitch pitch;
        private final StemDirection stem;
        private final TieState tie;

        public Tone(@NotNull Pitch pitch) {
            this(pitch, StemDirection.UNSPECIFIED, null);
        }

        /**
         * @param stem {@link StemDirection#UNSPECIFIED} inherits the chord's stem
         * @param tie null inherits the chord's tie
         */
        public Tone(@NotNull Pitch pitch, StemDirection stem, @Nullable TieState tie) {
            this.pitch = pitch;
            this.stem = stem == null ? StemDirection.UNSPECIFIED : stem;
            this.tie = tie;
        }

        public Pitch getPitch() {
            return pitch;
        }

        public StemDirection getStem() {
            return stem;
        }

        public @Nullable TieState getTie() {
            return tie;
        }
    }
}
