/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;


/**
 * Immutable settings of the {@link EvaluationDriver}. Defaults come from {@code score-similarity.properties} on the
 * classpath, an optional user file overrides them and {@code -Dscoresimilarity.<key>} system properties override both
 */
public final class EvaluationSettings {
    public static final String RESOURCE = "score-similarity.properties";
    public static final String SYSTEM_PREFIX = "scoresimilarity.";

    public static final String ESTIMATE_SUFFIX = "estimateSuffix";
    public static final String GROUND_TRUTH_SUFFIX = "groundTruthSuffix";
    public static final String NORMALIZE = "normalize";
    public static final String SENTINEL = "sentinel";

    public static final EvaluationSettings DEFAULT = new EvaluationSettings(".est.txt", ".gt.txt", true, -1);

    private final String estimateSuffix;
    private final String groundTruthSuffix;
    private final boolean normalize;
    private final double sentinel;

    public EvaluationSettings(String estimateSuffix, String groundTruthSuffix, boolean normalize, double sentinel) {
        if (StringUtils.isEmpty(estimateSuffix) || StringUtils.isEmpty(groundTruthSuffix))
            throw new IllegalArgumentException("file suffixes must not be empty");
        if (estimateSuffix.equals(groundTruthSuffix))
            throw new IllegalArgumentException("estimate and ground truth suffix are both " + estimateSuffix);
        this.estimateSuffix = estimateSuffix;
        this.groundTruthSuffix = groundTruthSuffix;
        this.normalize = normalize;
        this.sentinel = sentinel;
    }

    public static EvaluationSettings load() {
        return load(null);
    }

    /**
     * @param userFile properties overriding the classpath defaults, may be null
     */
    public static EvaluationSettings load(@Nullable Path userFile) {
        Properties properties = new Properties();
        try (InputStream in = EvaluationSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                properties.load(in);
            if (userFile != null) {
                try (Reader reader = Files.newBufferedReader(userFile, StandardCharsets.UTF_8)) {
                    properties.load(reader);
                }
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("could not read settings", e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX))
                properties.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
        }
        return fromProperties(properties);
    }

    public static EvaluationSettings fromProperties(Properties properties) {
        return new EvaluationSettings(
                properties.getProperty(ESTIMATE_SUFFIX, DEFAULT.estimateSuffix).trim(),
                properties.getProperty(GROUND_TRUTH_SUFFIX, DEFAULT.groundTruthSuffix).trim(),
                Boolean.parseBoolean(properties.getProperty(NORMALIZE, Boolean.toString(DEFAULT.normalize)).trim()),
                Double.parseDouble(properties.getProperty(SENTINEL, Double.toString(DEFAULT.sentinel)).trim()));
    }

    public String getEstimateSuffix() {
        return estimateSuffix;
    }

    public String getGroundTruthSuffix() {
        return groundTruthSuffix;
    }

    public boolean isNormalize() {
        return normalize;
    }

    public double getSentinel() {
        return sentinel;
    }

    public EvaluationSettings withNormalize(boolean normalize) {
        return new EvaluationSettings(estimateSuffix, groundTruthSuffix, normalize, sentinel);
    }

    @Override
    public String toString() {
        return "EvaluationSettings{estimate=" + estimateSuffix + ", groundTruth=" + groundTruthSuffix +
                ", normalize=" + normalize + ", sentinel=" + sentinel + "}";
    }
}
