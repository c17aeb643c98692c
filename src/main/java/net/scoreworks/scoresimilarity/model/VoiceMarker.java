/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.jetbrains.annotations.NotNull;

/**
 * Assigns the events written after it (up to the next marker or barline) to a named voice of the measure
 */
public final class VoiceMarker extends Event {
    /** voice of events outside any voice section */
    public static final String DEFAULT_VOICE = "1";

    private final String id;

    public VoiceMarker(@NotNull String id) {
        super(EventKind.VOICE_MARKER);
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return "Voice " + id;
    }
}
