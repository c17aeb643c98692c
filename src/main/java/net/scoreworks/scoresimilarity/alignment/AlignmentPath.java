/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.alignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;


/**
 * Monotonic correspondence between offsets of two scores, oldest anchor first
 */
public final class AlignmentPath implements Iterable<Anchor> {
    public static final AlignmentPath EMPTY = new AlignmentPath(Collections.emptyList());

    private final List<Anchor> anchors;

    public AlignmentPath(List<Anchor> anchors) {
        this.anchors = Collections.unmodifiableList(new ArrayList<>(anchors));
    }

    public List<Anchor> getAnchors() {
        return anchors;
    }

    public int size() {
        return anchors.size();
    }

    public boolean isEmpty() {
        return anchors.isEmpty();
    }

    public Anchor getFirst() {
        return anchors.get(0);
    }

    public Anchor getLast() {
        return anchors.get(anchors.size() - 1);
    }

    /**
     * @return true if both offset coordinates never decrease along the path
     */
    public boolean isMonotonic() {
        for (int i = 1; i < anchors.size(); i++) {
            Anchor previous = anchors.get(i - 1);
            Anchor current = anchors.get(i);
            if (current.getOffsetA().compareTo(previous.getOffsetA()) < 0 || current.getOffsetB().compareTo(previous.getOffsetB()) < 0)
                return false;
        }
        return true;
    }

    @Override
    public Iterator<Anchor> iterator() {
        return anchors.iterator();
    }

    @Override
    public String toString() {
        return anchors.toString();
    }
}
