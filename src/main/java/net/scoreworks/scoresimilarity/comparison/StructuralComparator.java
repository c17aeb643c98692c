/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.comparison.passes.ChordDecompositionPass;
import net.scoreworks.scoresimilarity.comparison.passes.CrossStaffPass;
import net.scoreworks.scoresimilarity.comparison.passes.EnharmonicPass;
import net.scoreworks.scoresimilarity.comparison.passes.ExactMatchPass;
import net.scoreworks.scoresimilarity.comparison.passes.ExactPitchPass;
import net.scoreworks.scoresimilarity.comparison.passes.ResidualPass;
import net.scoreworks.scoresimilarity.comparison.passes.RestDurationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * Turns one pair of comparison windows into an {@link ErrorVector} by running a fixed sequence of elimination passes.
 * Each pass only sees what the passes before it left unresolved, so the order decides which category a mismatch
 * is attributed to:
 * <ol>
 *     <li>{@link ExactMatchPass} removes identical items on the same staff</li>
 *     <li>{@link CrossStaffPass} pairs identical items on different staves</li>
 *     <li>{@link ChordDecompositionPass} splits remaining chords into notes</li>
 *     <li>{@link ExactPitchPass} pairs notes of the same spelled pitch and compares their attributes</li>
 *     <li>{@link RestDurationPass} pairs rests of different duration</li>
 *     <li>{@link EnharmonicPass} pairs notes that are spelled differently but sound the same</li>
 *     <li>{@link ResidualPass} counts the leftovers as insertions and deletions</li>
 * </ol>
 * Window A is the ground truth, window B the estimate.
 */
public class StructuralComparator {
    private static final Logger logger = LoggerFactory.getLogger(StructuralComparator.class);

    private final List<ComparisonPass> passes;

    public StructuralComparator() {
        this(Arrays.asList(
                new ExactMatchPass(),
                new CrossStaffPass(),
                new ChordDecompositionPass(),
                new ExactPitchPass(),
                new RestDurationPass(),
                new EnharmonicPass(),
                new ResidualPass()));
    }

    StructuralComparator(List<ComparisonPass> passes) {
        this.passes = Collections.unmodifiableList(passes);
    }

    public ErrorVector compare(List<ScoreItem> windowA, List<ScoreItem> windowB) {
        return run(windowA, windowB).getErrors();
    }

    public ErrorVector compare(WindowPair windows) {
        return compare(windows.getWindowA().getItems(), windows.getWindowB().getItems());
    }

    /**
     * @return the final state, including what remained unresolved on either side
     */
    public ComparisonState run(List<ScoreItem> windowA, List<ScoreItem> windowB) {
        ComparisonState state = ComparisonState.initial(windowA, windowB);
        for (ComparisonPass pass : passes) {
            state = pass.apply(state);
            if (logger.isTraceEnabled())
                logger.trace("after {}: {}", pass.getClass().getSimpleName(), state);
        }
        if (!state.getErrors().isZero())
            logger.debug("window of {} and {} items: {}", windowA.size(), windowB.size(), state.getErrors());
        return state;
    }

    public List<ComparisonPass> getPasses() {
        return passes;
    }
}
