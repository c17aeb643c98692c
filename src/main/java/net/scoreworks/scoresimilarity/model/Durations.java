/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.apache.commons.lang3.math.Fraction;


/**
 * Helpers for offsets and durations, which are {@link Fraction}s of quarter notes. All fractions handed out are
 * reduced, so that {@link Fraction#equals(Object)} is exact rational equality
 */
public final class Durations {
    public static final Fraction QUARTER = Fraction.ONE;
    public static final Fraction HALF = Fraction.getFraction(2, 1);
    public static final Fraction WHOLE = Fraction.getFraction(4, 1);
    public static final Fraction EIGHTH = Fraction.ONE_HALF;

    private Durations() {}

    public static Fraction of(int numerator, int denominator) {
        return Fraction.getReducedFraction(numerator, denominator);
    }

    public static Fraction of(int quarters) {
        return Fraction.getFraction(quarters, 1);
    }

    /**
     * @param text {@code 3/2}, {@code 2} or a decimal like {@code 1.5}
     */
    public static Fraction parse(String text) {
        return Fraction.getFraction(text.trim()).reduce();
    }

    /**
     * @return improper fraction without a denominator of 1, e.g. {@code 3/2} or {@code 2}
     */
    public static String format(Fraction fraction) {
        Fraction reduced = fraction.reduce();
        if (reduced.getDenominator() == 1)
            return Integer.toString(reduced.getNumerator());
        return reduced.getNumerator() + "/" + reduced.getDenominator();
    }

    public static boolean equal(Fraction a, Fraction b) {
        if (a == null || b == null)
            return a == b;
        return a.compareTo(b) == 0;
    }

    public static Fraction max(Fraction a, Fraction b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
