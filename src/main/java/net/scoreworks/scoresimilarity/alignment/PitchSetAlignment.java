/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.alignment;

import net.scoreworks.scoresimilarity.model.Chord;
import net.scoreworks.scoresimilarity.model.Note;
import net.scoreworks.scoresimilarity.model.Pitch;
import net.scoreworks.scoresimilarity.model.Score;
import net.scoreworks.scoresimilarity.model.Staff;
import net.scoreworks.scoresimilarity.model.StaffEntry;
import org.apache.commons.collections4.bag.HashBag;
import org.apache.commons.lang3.math.Fraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;


/**
 * Builds a rough time correspondence between two scores from their pitch content only. Each score is flattened into
 * {@link PitchGroup}s, and an edit distance over the groups is computed whose local cost is the size of the pitch
 * multiset difference. Unlike the textbook recurrence, row 0 and column 0 are unreachable, so every path starts
 * with a pair of first groups. The path is backtracked with the same ordered tie-break used for filling the matrix
 */
public class PitchSetAlignment {
    private static final Logger logger = LoggerFactory.getLogger(PitchSetAlignment.class);

    private static final int DELETE_FROM_A = 0;
    private static final int DELETE_FROM_B = 1;

    public AlignmentResult align(Score scoreA, Score scoreB) {
        List<PitchGroup> groupsA = pitchGroups(scoreA);
        List<PitchGroup> groupsB = pitchGroups(scoreB);
        CostMatrix matrix = costMatrix(groupsA, groupsB);
        int m = groupsA.size();
        int n = groupsB.size();

        if (m == 0 || n == 0) {
            logger.debug("degenerate alignment of {} and {} pitch groups", m, n);
            return new AlignmentResult(AlignmentPath.EMPTY, matrix, groupsA, groupsB);
        }

        LinkedList<Anchor> anchors = new LinkedList<>();
        int i = m, j = n;
        while (!(i == 0 && j == 0)) {
            anchors.addFirst(new Anchor(i, j, groupsA.get(i - 1).getOffset(), groupsB.get(j - 1).getOffset()));
            int move = matrix.argMinPredecessor(i, j);
            if (move == DELETE_FROM_A)
                i--;
            else if (move == DELETE_FROM_B)
                j--;
            else {
                i--;
                j--;
            }
        }
        logger.debug("aligned {} with {} pitch groups, cost {}, path length {}", m, n, matrix.total(), anchors.size());
        return new AlignmentResult(new AlignmentPath(anchors), matrix, groupsA, groupsB);
    }

    static CostMatrix costMatrix(List<PitchGroup> s, List<PitchGroup> t) {
        int m = s.size();
        int n = t.size();
        double[][] d = new double[m + 1][n + 1];
        int[][] localCosts = new int[m][n];

        for (int i = 1; i <= m; i++)
            d[i][0] = Double.POSITIVE_INFINITY;
        for (int j = 1; j <= n; j++)
            d[0][j] = Double.POSITIVE_INFINITY;

        CostMatrix matrix = new CostMatrix(d, localCosts);
        for (int j = 1; j <= n; j++) {
            for (int i = 1; i <= m; i++) {
                int cost = s.get(i - 1).mismatches(t.get(j - 1));
                localCosts[i - 1][j - 1] = cost;
                int move = matrix.argMinPredecessor(i, j);
                if (move == DELETE_FROM_A)
                    d[i][j] = d[i - 1][j] + cost;
                else if (move == DELETE_FROM_B)
                    d[i][j] = d[i][j - 1] + cost;
                else
                    d[i][j] = d[i - 1][j - 1] + cost;
            }
        }
        return matrix;
    }

    /**
     * Merge both staves of a score into groups of sounding pitches per offset. Offsets without notes or chords
     * produce no group
     */
    public static List<PitchGroup> pitchGroups(Score score) {
        Map<Fraction, HashBag<Integer>> byOffset = new TreeMap<>();
        for (Staff staff : score.getStaves()) {
            for (StaffEntry entry : staff.getEntries()) {
                switch (entry.getEvent().getKind()) {
                    case NOTE:
                        byOffset.computeIfAbsent(entry.getOffset(), k -> new HashBag<>())
                                .add(((Note) entry.getEvent()).getPitch().midi());
                        break;
                    case CHORD:
                        HashBag<Integer> group = byOffset.computeIfAbsent(entry.getOffset(), k -> new HashBag<>());
                        for (Pitch pitch : ((Chord) entry.getEvent()).getPitches())
                            group.add(pitch.midi());
                        break;
                    default:
                        break;
                }
            }
        }
        List<PitchGroup> groups = new ArrayList<>();
        for (Map.Entry<Fraction, HashBag<Integer>> entry : byOffset.entrySet())
            groups.add(new PitchGroup(entry.getKey(), entry.getValue()));
        return groups;
    }
}
