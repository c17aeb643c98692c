/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity;

import net.scoreworks.scoresimilarity.alignment.AlignmentPath;
import net.scoreworks.scoresimilarity.alignment.AlignmentResult;
import net.scoreworks.scoresimilarity.alignment.PitchSetAlignment;
import net.scoreworks.scoresimilarity.comparison.ErrorVector;
import net.scoreworks.scoresimilarity.comparison.ScoreItem;
import net.scoreworks.scoresimilarity.comparison.StructuralComparator;
import net.scoreworks.scoresimilarity.comparison.WindowPair;
import net.scoreworks.scoresimilarity.comparison.WindowPartitioner;
import net.scoreworks.scoresimilarity.model.Score;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;


/**
 * Entry point of the engine. Evaluating an estimated score against its ground truth
 * <ol>
 *     <li>aligns both scores by pitch content ({@link PitchSetAlignment}),</li>
 *     <li>slices both full event timelines into corresponding windows along the alignment path
 *     ({@link WindowPartitioner}),</li>
 *     <li>classifies the discrepancies of every window pair ({@link StructuralComparator}) and sums them up.</li>
 * </ol>
 * Instances hold no state between evaluations, so one instance may evaluate several pairs concurrently.
 */
public class ScoreSimilarity {
    private static final Logger logger = LoggerFactory.getLogger(ScoreSimilarity.class);

    private final PitchSetAlignment alignment;
    private final WindowPartitioner partitioner;
    private final StructuralComparator comparator;

    public ScoreSimilarity() {
        this(new PitchSetAlignment(), new WindowPartitioner(), new StructuralComparator());
    }

    public ScoreSimilarity(PitchSetAlignment alignment, WindowPartitioner partitioner, StructuralComparator comparator) {
        this.alignment = alignment;
        this.partitioner = partitioner;
        this.comparator = comparator;
    }

    /**
     * @return errors of the estimate summed over all windows, carrying the symbol counts of the ground truth
     */
    public ErrorVector evaluate(Score groundTruth, Score estimate) {
        AlignmentResult result = align(groundTruth, estimate);
        if (result.isDegenerate())
            logger.debug("no pitched content on one side, comparing whole scores");
        ErrorVector errors = ErrorVector.ZERO;
        for (WindowPair windows : partition(result.getPath(), groundTruth, estimate))
            errors = errors.plus(comparator.compare(windows));
        return errors.withSymbolCounts(groundTruth.countSymbols());
    }

    public AlignmentResult align(Score scoreA, Score scoreB) {
        return alignment.align(scoreA, scoreB);
    }

    public List<WindowPair> partition(AlignmentPath path, Score scoreA, Score scoreB) {
        return partitioner.partition(path, ScoreItem.flatten(scoreA), ScoreItem.flatten(scoreB));
    }

    public ErrorVector compare(WindowPair windows) {
        return comparator.compare(windows);
    }
}
