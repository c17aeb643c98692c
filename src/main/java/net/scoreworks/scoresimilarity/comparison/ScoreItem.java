/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.model.Durations;
import net.scoreworks.scoresimilarity.model.Event;
import net.scoreworks.scoresimilarity.model.EventContext;
import net.scoreworks.scoresimilarity.model.EventKind;
import net.scoreworks.scoresimilarity.model.Score;
import net.scoreworks.scoresimilarity.model.Staff;
import net.scoreworks.scoresimilarity.model.StaffEntry;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;


/**
 * An event of either staff as seen by the comparator. Items are compared by identity, so removing one item from a
 * working set never removes a structurally equal sibling
 */
public final class ScoreItem {
    private final int staff;
    private final Fraction offset;
    private final Event event;
    private final EventContext context;

    public ScoreItem(int staff, Fraction offset, Event event, EventContext context) {
        this.staff = staff;
        this.offset = offset;
        this.event = event;
        this.context = context;
    }

    /**
     * @return item for the same position and context but another event, used for chord decomposition
     */
    public ScoreItem withEvent(Event event) {
        return new ScoreItem(staff, offset, event, context);
    }

    public int getStaff() {
        return staff;
    }

    public Fraction getOffset() {
        return offset;
    }

    public Event getEvent() {
        return event;
    }

    public EventContext getContext() {
        return context;
    }

    /**
     * Merge all staves of a score into one list ordered by offset. Items sharing an offset keep staff order.
     * Voice markers are left out, voices are compared through each note's {@link EventContext}
     */
    public static List<ScoreItem> flatten(Score score) {
        List<ScoreItem> items = new ArrayList<>();
        for (Staff staff : score.getStaves()) {
            for (StaffEntry entry : staff.getEntries()) {
                if (entry.getEvent().getKind() == EventKind.VOICE_MARKER)
                    continue;
                items.add(new ScoreItem(staff.getIndex(), entry.getOffset(), entry.getEvent(), entry.getContext()));
            }
        }
        items.sort(Comparator.comparing(ScoreItem::getOffset));
        return items;
    }

    @Override
    public String toString() {
        return "(" + staff + ", " + Durations.format(offset) + ", " + event + ")";
    }
}
