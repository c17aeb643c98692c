/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.exceptions;

public class TokenFormatException extends RuntimeException {
    public TokenFormatException(String message, int tokenIndex) {
        super(message + " at token ["+tokenIndex+"]");
    }

    public TokenFormatException(String message, int tokenIndex, Throwable cause) {
        super(message + " at token ["+tokenIndex+"]", cause);
    }
}
