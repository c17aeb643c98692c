/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

/**
 * One elimination step of the {@link StructuralComparator}. A pass never mutates its input; it returns what is left
 * unresolved for the following passes together with the updated error counts
 */
public interface ComparisonPass {
    ComparisonState apply(ComparisonState state);
}
