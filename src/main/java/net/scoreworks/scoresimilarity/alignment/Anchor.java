/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.alignment;

import net.scoreworks.scoresimilarity.model.Durations;
import org.apache.commons.lang3.math.Fraction;

import java.util.Objects;


/**
 * One step of an {@link AlignmentPath}: the cell (row, col) of the {@link CostMatrix} that was visited and the
 * offsets of the two pitch groups it pairs
 */
public final class Anchor {
    private final int row;
    private final int col;
    private final Fraction offsetA;
    private final Fraction offsetB;

    Anchor(int row, int col, Fraction offsetA, Fraction offsetB) {
        this.row = row;
        this.col = col;
        this.offsetA = offsetA;
        this.offsetB = offsetB;
    }

    public static Anchor of(Fraction offsetA, Fraction offsetB) {
        return new Anchor(-1, -1, offsetA, offsetB);
    }

    /** 1-based index of the pitch group of score A, -1 if not taken from a matrix */
    public int getRow() {
        return row;
    }

    /** 1-based index of the pitch group of score B, -1 if not taken from a matrix */
    public int getCol() {
        return col;
    }

    public Fraction getOffsetA() {
        return offsetA;
    }

    public Fraction getOffsetB() {
        return offsetB;
    }

    /**
     * anchors are equal if they pair the same offsets
     */
    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Anchor))
            return false;
        Anchor other = (Anchor) o;
        return Durations.equal(offsetA, other.offsetA) && Durations.equal(offsetB, other.offsetB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(offsetA.reduce(), offsetB.reduce());
    }

    @Override
    public String toString() {
        return "(" + Durations.format(offsetA) + ", " + Durations.format(offsetB) + ")";
    }
}
