/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.model.SymbolCounts;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Immutable count of discrepancies per {@link ErrorKind}, optionally carrying the {@link SymbolCounts} of the ground
 * truth it gets normalized by. Vectors of single comparison windows are summed with {@link #plus(ErrorVector)}
 */
public final class ErrorVector {
    public static final ErrorVector ZERO = new ErrorVector(new int[ErrorKind.values().length], SymbolCounts.NONE);

    private final int[] counts;
    private final SymbolCounts symbolCounts;

    private ErrorVector(int[] counts, SymbolCounts symbolCounts) {
        this.counts = counts;
        this.symbolCounts = symbolCounts;
    }

    public int get(ErrorKind kind) {
        return counts[kind.ordinal()];
    }

    public SymbolCounts getSymbolCounts() {
        return symbolCounts;
    }

    public int total() {
        int total = 0;
        for (int count : counts)
            total += count;
        return total;
    }

    public boolean isZero() {
        return total() == 0;
    }

    /**
     * @return element-wise sum. Symbol counts are kept from this vector
     */
    public ErrorVector plus(ErrorVector other) {
        int[] sum = counts.clone();
        for (int i = 0; i < sum.length; i++)
            sum[i] += other.counts[i];
        return new ErrorVector(sum, symbolCounts);
    }

    public ErrorVector withSymbolCounts(SymbolCounts symbolCounts) {
        return new ErrorVector(counts, symbolCounts);
    }

    /**
     * @return every count divided by the ground truth count of its {@link ErrorKind#getSymbolClass() symbol class},
     * 0 where that class does not occur in the ground truth
     */
    public double normalized(ErrorKind kind) {
        int symbols = symbolCounts.get(kind.getSymbolClass());
        return symbols == 0 ? 0 : (double) get(kind) / symbols;
    }

    /**
     * @return raw counts by label, followed by the symbol counts {@code n_Note}, {@code n_Chord} (notes inside
     * chords) and {@code n_Rest}
     */
    public Map<String, Integer> toMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (ErrorKind kind : ErrorKind.values())
            map.put(kind.getLabel(), get(kind));
        map.put("n_Note", symbolCounts.getNotes());
        map.put("n_Chord", symbolCounts.getChordNotes());
        map.put("n_Rest", symbolCounts.getRests());
        return map;
    }

    public Builder toBuilder() {
        return new Builder(counts.clone(), symbolCounts);
    }

    public static Builder builder() {
        return ZERO.toBuilder();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ErrorVector))
            return false;
        ErrorVector other = (ErrorVector) o;
        return Arrays.equals(counts, other.counts) && symbolCounts.equals(other.symbolCounts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts) * 31 + symbolCounts.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder strb = new StringBuilder("{");
        for (ErrorKind kind : ErrorKind.values()) {
            if (get(kind) == 0)
                continue;
            if (strb.length() > 1)
                strb.append(", ");
            strb.append(kind.getLabel()).append('=').append(get(kind));
        }
        return strb.append('}').toString();
    }

    public static final class Builder {
        private final int[] counts;
        private final SymbolCounts symbolCounts;

        private Builder(int[] counts, SymbolCounts symbolCounts) {
            this.counts = counts;
            this.symbolCounts = symbolCounts;
        }

        public Builder increment(ErrorKind kind) {
            return add(kind, 1);
        }

        public Builder add(ErrorKind kind, int amount) {
            counts[kind.ordinal()] += amount;
            return this;
        }

        public ErrorVector build() {
            return new ErrorVector(counts.clone(), symbolCounts);
        }
    }
}
