/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.alignment;

/**
 * Read-only (m+1)x(n+1) accumulated cost matrix of a pitch set alignment, together with the m x n local costs.
 * Row 0 and column 0 are unreachable (+inf) except for the origin
 */
public final class CostMatrix {
    private final double[][] d;
    private final int[][] localCosts;

    CostMatrix(double[][] d, int[][] localCosts) {
        this.d = d;
        this.localCosts = localCosts;
    }

    public int rows() {
        return d.length;
    }

    public int cols() {
        return d[0].length;
    }

    public double get(int i, int j) {
        return d[i][j];
    }

    /**
     * @param i 1-based pitch group index of score A
     * @param j 1-based pitch group index of score B
     */
    public int localCost(int i, int j) {
        return localCosts[i - 1][j - 1];
    }

    /**
     * @return the accumulated cost at the bottom right corner
     */
    public double total() {
        return d[rows() - 1][cols() - 1];
    }

    /**
     * index of the predecessor with minimal accumulated cost, ties resolve to the first in the order
     * [delete from A (up), delete from B (left), substitute (diagonal)]
     */
    int argMinPredecessor(int i, int j) {
        double up = d[i - 1][j];
        double left = d[i][j - 1];
        double diagonal = d[i - 1][j - 1];
        int idx = 0;
        double min = up;
        if (left < min) {
            idx = 1;
            min = left;
        }
        if (diagonal < min)
            idx = 2;
        return idx;
    }
}
