/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.exceptions;

/**
 * Thrown if ingestion produced a score whose staff/offset structure is inconsistent. Fatal to the comparison
 * the score takes part in, but not to a batch of comparisons
 */
public class MalformedScoreException extends RuntimeException {
    public MalformedScoreException(String message) {
        super(message);
    }

    public MalformedScoreException(int staff, Object offset, String message) {
        super("staff " + staff + " at offset " + offset + ": " + message);
    }
}
