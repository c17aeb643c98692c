/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

public final class WindowPair {
    private final Window windowA;
    private final Window windowB;

    WindowPair(Window windowA, Window windowB) {
        this.windowA = windowA;
        this.windowB = windowB;
    }

    public Window getWindowA() {
        return windowA;
    }

    public Window getWindowB() {
        return windowB;
    }

    @Override
    public String toString() {
        return windowA + " vs " + windowB;
    }
}
