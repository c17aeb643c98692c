/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;


/**
 * {@code Main <directory> <output.json> [settings.properties]}
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws IOException {
        if (args.length < 2 || args.length > 3) {
            System.err.println("usage: Main <directory> <output.json> [settings.properties]");
            System.exit(2);
        }
        EvaluationSettings settings = EvaluationSettings.load(args.length == 3 ? Paths.get(args[2]) : null);
        logger.info("using {}", settings);
        EvaluationTable table = new EvaluationDriver(settings).run(Paths.get(args[0]));
        Path output = Paths.get(args[1]);
        table.write(output);
        logger.info("wrote {} rows to {}", table.getRows().size(), output);
    }
}
