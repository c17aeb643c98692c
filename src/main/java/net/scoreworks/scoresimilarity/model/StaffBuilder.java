/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import net.scoreworks.scoresimilarity.exceptions.MalformedScoreException;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;


/**
 * Collects events of one staff in writing order and resolves the {@link EventContext} of each of them. Events of
 * different voices may be added out of time order; {@link #build()} orders them by offset, keeping writing order
 * among equal offsets
 */
public class StaffBuilder {
    private final int index;
    private final List<StaffEntry> entries = new ArrayList<>();
    private EventContext context = EventContext.DEFAULT;

    public StaffBuilder(int index) {
        this.index = index;
    }

    public StaffBuilder add(Fraction offset, Event event) {
        if (offset == null)
            throw new MalformedScoreException(index, null, "missing offset for " + event);
        if (offset.compareTo(Fraction.ZERO) < 0)
            throw new MalformedScoreException(index, offset, "negative offset for " + event);
        if (event == null)
            throw new MalformedScoreException(index, offset, "missing event");
        switch (event.getKind()) {
            case CLEF:
                context = context.withClef(((Clef) event).getClefKind());
                break;
            case KEY_SIGNATURE:
                context = context.withKeySharps(((KeySignature) event).getSharps());
                break;
            case TIME_SIGNATURE:
                context = context.withTimeSignature((TimeSignature) event);
                break;
            case VOICE_MARKER:
                context = context.withVoice(((VoiceMarker) event).getId());
                break;
            case BARLINE:
            case MEASURE_BOUNDARY:
                //voices are scoped to a measure
                context = context.withVoice(VoiceMarker.DEFAULT_VOICE);
                break;
            default:
                break;
        }
        entries.add(new StaffEntry(offset, event, context));
        return this;
    }

    /**
     * @return the context the next added event will be written in
     */
    public EventContext getContext() {
        return context;
    }

    public int getIndex() {
        return index;
    }

    public Staff build() {
        List<StaffEntry> ordered = new ArrayList<>(entries);
        //List.sort is stable
        ordered.sort(Comparator.comparing(StaffEntry::getOffset));
        return new Staff(index, ordered);
    }
}
