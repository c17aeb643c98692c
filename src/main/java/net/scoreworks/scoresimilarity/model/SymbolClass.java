/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

/**
 * Classes of ground truth symbols that error counts get normalized by
 */
public enum SymbolClass {
    NOTE, REST
}
