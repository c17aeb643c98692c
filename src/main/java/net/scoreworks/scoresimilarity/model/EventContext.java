/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.apache.commons.lang3.math.Fraction;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;


/**
 * Immutable notational context an event was written in: the latest clef, key signature and time signature of its
 * staff and the voice it belongs to
 */
public final class EventContext {
    public static final EventContext DEFAULT = new EventContext(null, 0, null, VoiceMarker.DEFAULT_VOICE);

    private final ClefKind clef;
    private final int keySharps;
    private final TimeSignature timeSignature;
    private final String voice;

    public EventContext(@Nullable ClefKind clef, int keySharps, @Nullable TimeSignature timeSignature, String voice) {
        this.clef = clef;
        this.keySharps = keySharps;
        this.timeSignature = timeSignature;
        this.voice = voice == null ? VoiceMarker.DEFAULT_VOICE : voice;
    }

    public @Nullable ClefKind getClef() {
        return clef;
    }

    public int getKeySharps() {
        return keySharps;
    }

    public @Nullable TimeSignature getTimeSignature() {
        return timeSignature;
    }

    /**
     * @return beats-per-measure ratio of the time signature, null if none was written yet
     */
    public @Nullable Fraction getTimeSignatureRatio() {
        return timeSignature == null ? null : timeSignature.ratio();
    }

    public String getVoice() {
        return voice;
    }

    public EventContext withClef(ClefKind clef) {
        return new EventContext(clef, keySharps, timeSignature, voice);
    }

    public EventContext withKeySharps(int keySharps) {
        return new EventContext(clef, keySharps, timeSignature, voice);
    }

    public EventContext withTimeSignature(TimeSignature timeSignature) {
        return new EventContext(clef, keySharps, timeSignature, voice);
    }

    public EventContext withVoice(String voice) {
        return new EventContext(clef, keySharps, timeSignature, voice);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof EventContext))
            return false;
        EventContext other = (EventContext) o;
        return clef == other.clef && keySharps == other.keySharps && voice.equals(other.voice)
                && Objects.equals(getTimeSignatureRatio(), other.getTimeSignatureRatio());
    }

    @Override
    public int hashCode() {
        return Objects.hash(clef, keySharps, getTimeSignatureRatio(), voice);
    }

    @Override
    public String toString() {
        return "[clef=" + clef + ", key=" + keySharps + ", time=" + timeSignature + ", voice=" + voice + "]";
    }
}
