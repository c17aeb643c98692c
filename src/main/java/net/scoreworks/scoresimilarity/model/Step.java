/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

/**
 * Letter name of a pitch, together with its semitone distance from C
 */
public enum Step {
    C(0), D(2), E(4), F(5), G(7), A(9), B(11);

    private final int semitone;

    Step(int semitone) {
        this.semitone = semitone;
    }

    public int getSemitone() {
        return semitone;
    }

    public static Step fromLetter(char letter) {
        for (Step step : values()) {
            if (step.name().charAt(0) == letter)
                return step;
        }
        throw new IllegalArgumentException("no step named " + letter);
    }
}
