/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;


/**
 * Immutable snapshot between two {@link ComparisonPass}es: what is still unresolved on either side, and the errors
 * counted so far
 */
public final class ComparisonState {
    private final List<ScoreItem> remainingA;
    private final List<ScoreItem> remainingB;
    private final ErrorVector errors;
    private final int decomposedChords;

    private ComparisonState(List<ScoreItem> remainingA, List<ScoreItem> remainingB, ErrorVector errors, int decomposedChords) {
        this.remainingA = Collections.unmodifiableList(new ArrayList<>(remainingA));
        this.remainingB = Collections.unmodifiableList(new ArrayList<>(remainingB));
        this.errors = errors;
        this.decomposedChords = decomposedChords;
    }

    public static ComparisonState initial(List<ScoreItem> windowA, List<ScoreItem> windowB) {
        return new ComparisonState(windowA, windowB, ErrorVector.ZERO, 0);
    }

    public ComparisonState next(List<ScoreItem> remainingA, List<ScoreItem> remainingB, ErrorVector errors) {
        return new ComparisonState(remainingA, remainingB, errors, decomposedChords);
    }

    public ComparisonState withDecomposedChords(int chords) {
        return new ComparisonState(remainingA, remainingB, errors, decomposedChords + chords);
    }

    public List<ScoreItem> getRemainingA() {
        return remainingA;
    }

    public List<ScoreItem> getRemainingB() {
        return remainingB;
    }

    public ErrorVector getErrors() {
        return errors;
    }

    /**
     * number of chords split into single notes on both sides, kept for the former "grouping" error
     */
    public int getDecomposedChords() {
        return decomposedChords;
    }

    /**
     * Remove the first item matching the predicate from a working list
     * @return the removed item, or null if none matched
     */
    public static ScoreItem removeFirst(List<ScoreItem> items, Predicate<ScoreItem> predicate) {
        for (int i = 0; i < items.size(); i++) {
            if (predicate.test(items.get(i)))
                return items.remove(i);
        }
        return null;
    }

    @Override
    public String toString() {
        return "A=" + remainingA + ", B=" + remainingB + ", errors=" + errors;
    }
}
