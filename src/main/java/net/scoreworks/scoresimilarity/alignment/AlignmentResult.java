/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.alignment;

import java.util.Collections;
import java.util.List;


public final class AlignmentResult {
    private final AlignmentPath path;
    private final CostMatrix costMatrix;
    private final List<PitchGroup> groupsA;
    private final List<PitchGroup> groupsB;

    AlignmentResult(AlignmentPath path, CostMatrix costMatrix, List<PitchGroup> groupsA, List<PitchGroup> groupsB) {
        this.path = path;
        this.costMatrix = costMatrix;
        this.groupsA = Collections.unmodifiableList(groupsA);
        this.groupsB = Collections.unmodifiableList(groupsB);
    }

    public AlignmentPath getPath() {
        return path;
    }

    public CostMatrix getCostMatrix() {
        return costMatrix;
    }

    public List<PitchGroup> getGroupsA() {
        return groupsA;
    }

    public List<PitchGroup> getGroupsB() {
        return groupsB;
    }

    /**
     * @return true if one of the scores has no pitched events, in which case the path is empty
     */
    public boolean isDegenerate() {
        return groupsA.isEmpty() || groupsB.isEmpty();
    }

    /**
     * @return sum of the local costs of all cells visited by the path
     */
    public int pathCost() {
        int cost = 0;
        for (Anchor anchor : path)
            cost += costMatrix.localCost(anchor.getRow(), anchor.getCol());
        return cost;
    }
}
