/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.exceptions;

/**
 * An event was encountered that the error taxonomy has no rule for. Never ignored, since dropping it would leave
 * the error counts incomplete
 */
public class UnsupportedEventKindException extends RuntimeException {
    public UnsupportedEventKindException(Object kind, String stage) {
        super("Event kind " + kind + " is not supported by " + stage);
    }
}
