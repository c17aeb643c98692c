/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.alignment.AlignmentPath;
import net.scoreworks.scoresimilarity.alignment.Anchor;
import org.apache.commons.lang3.math.Fraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;


/**
 * Slices the full event timelines of two scores into corresponding comparison windows along an
 * {@link AlignmentPath}. A window is closed whenever both offsets of an anchor advance. Anchors where only one
 * offset advances widen the open window on that side only, so unmatched content of an insertion or deletion run
 * stays inside a window. A last, unbounded window collects everything after the final closing anchor
 */
public class WindowPartitioner {
    private static final Logger logger = LoggerFactory.getLogger(WindowPartitioner.class);

    /**
     * @param itemsA all items of score A, ordered by offset
     * @param itemsB all items of score B, ordered by offset
     */
    public List<WindowPair> partition(AlignmentPath path, List<ScoreItem> itemsA, List<ScoreItem> itemsB) {
        List<WindowPair> windows = new ArrayList<>();
        Fraction aStart = Fraction.ZERO, aEnd = Fraction.ZERO;
        Fraction bStart = Fraction.ZERO, bEnd = Fraction.ZERO;

        for (Anchor anchor : path) {
            boolean aAdvances = anchor.getOffsetA().compareTo(aEnd) != 0;
            boolean bAdvances = anchor.getOffsetB().compareTo(bEnd) != 0;
            if (aAdvances && bAdvances) {
                aEnd = anchor.getOffsetA();
                bEnd = anchor.getOffsetB();
                windows.add(new WindowPair(Window.select(itemsA, aStart, aEnd), Window.select(itemsB, bStart, bEnd)));
                aStart = aEnd;
                bStart = bEnd;
            }
            else if (bAdvances) {
                bEnd = anchor.getOffsetB();
            }
            else if (aAdvances) {
                aEnd = anchor.getOffsetA();
            }
            //neither advances: no new boundary
        }
        windows.add(new WindowPair(Window.select(itemsA, aStart, null), Window.select(itemsB, bStart, null)));
        logger.debug("partitioned {} anchors into {} windows", path.size(), windows.size());
        return windows;
    }
}
