/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.apache.commons.lang3.math.Fraction;

public final class TimeSignature extends Event {
    private final int numerator;
    private final int beatUnit;

    public TimeSignature(int numerator, int beatUnit) {
        super(EventKind.TIME_SIGNATURE);
        if (numerator <= 0 || beatUnit <= 0)
            throw new IllegalArgumentException("invalid time signature " + numerator + "/" + beatUnit);
        this.numerator = numerator;
        this.beatUnit = beatUnit;
    }

    public int getNumerator() {
        return numerator;
    }

    public int getBeatUnit() {
        return beatUnit;
    }

    /**
     * @return numerator/beatUnit, reduced. 3/4 and 6/8 share the same ratio
     */
    public Fraction ratio() {
        return Fraction.getReducedFraction(numerator, beatUnit);
    }

    /**
     * @return length of a full measure in quarter notes
     */
    public Fraction measureLength() {
        return Fraction.getReducedFraction(4 * numerator, beatUnit);
    }

    @Override
    public String toString() {
        return "TimeSignature " + numerator + "/" + beatUnit;
    }
}
