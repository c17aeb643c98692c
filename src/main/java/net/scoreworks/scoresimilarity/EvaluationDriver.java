/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity;

import net.scoreworks.scoresimilarity.comparison.ErrorVector;
import net.scoreworks.scoresimilarity.exceptions.MalformedScoreException;
import net.scoreworks.scoresimilarity.exceptions.TokenFormatException;
import net.scoreworks.scoresimilarity.model.Score;
import net.scoreworks.scoresimilarity.tokens.ScoreDetokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;


/**
 * Evaluates every {@code <name><estimateSuffix>} token file of a directory against its
 * {@code <name><groundTruthSuffix>} counterpart. A pair that cannot be read or parsed is logged and ends up as a
 * sentinel row, the remaining pairs are still evaluated
 */
public class EvaluationDriver {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationDriver.class);

    private final EvaluationSettings settings;
    private final ScoreDetokenizer detokenizer;
    private final ScoreSimilarity similarity;

    public EvaluationDriver(EvaluationSettings settings) {
        this(settings, new ScoreDetokenizer(), new ScoreSimilarity());
    }

    public EvaluationDriver(EvaluationSettings settings, ScoreDetokenizer detokenizer, ScoreSimilarity similarity) {
        this.settings = settings;
        this.detokenizer = detokenizer;
        this.similarity = similarity;
    }

    public EvaluationTable run(Path directory) throws IOException {
        EvaluationTable table = new EvaluationTable(settings.getSentinel());
        List<String> names = pairNames(directory);
        logger.info("evaluating {} score pairs in {}", names.size(), directory);
        for (String name : names) {
            Path estimate = directory.resolve(name + settings.getEstimateSuffix());
            Path groundTruth = directory.resolve(name + settings.getGroundTruthSuffix());
            try {
                ErrorVector errors = evaluate(groundTruth, estimate);
                logger.debug("{}: {}", name, errors);
                table.add(name, errors, settings.isNormalize());
            }
            catch (IOException | TokenFormatException | MalformedScoreException e) {
                logger.warn("skipping pair {}", name, e);
                table.addFailure(name);
            }
        }
        return table;
    }

    public ErrorVector evaluate(Path groundTruth, Path estimate) throws IOException {
        Score groundTruthScore = read(groundTruth);
        Score estimateScore = read(estimate);
        return similarity.evaluate(groundTruthScore, estimateScore);
    }

    private Score read(Path file) throws IOException {
        return detokenizer.detokenize(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * @return sorted names of all estimates, estimates without a ground truth are logged and left out
     */
    List<String> pairNames(Path directory) throws IOException {
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                String fileName = file.getFileName().toString();
                if (!fileName.endsWith(settings.getEstimateSuffix()))
                    return;
                String name = fileName.substring(0, fileName.length() - settings.getEstimateSuffix().length());
                if (Files.isRegularFile(directory.resolve(name + settings.getGroundTruthSuffix())))
                    names.add(name);
                else
                    logger.warn("no ground truth for estimate {}", fileName);
            });
        }
        Collections.sort(names);
        return names;
    }
}
