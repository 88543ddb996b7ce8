package com.tilemerge.core.ai;

import com.tilemerge.core.driver.LocalGameDriver;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link AutoPlayer} sessions with configurable search
 * parameters.
 */
public final class AutoPlayerRunner {

    private static final Logger LOGGER = Logger.getLogger(AutoPlayerRunner.class.getName());

    private AutoPlayerRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 6) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            SearchConstraints constraints = SearchConstraints.defaults();
            long seed = System.nanoTime();
            boolean keepPlaying = true;

            for (int index = 1; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--mode=")) {
                    String value = option.substring("--mode=".length()).toUpperCase(Locale.ROOT);
                    constraints = constraints.withMode(SearchConstraints.SearchMode.valueOf(value));
                } else if (option.startsWith("--seed=")) {
                    seed = Long.parseLong(option.substring("--seed=".length()));
                } else if (option.startsWith("--keep-playing=")) {
                    keepPlaying = parseBoolean(option.substring("--keep-playing=".length()));
                } else if (option.startsWith("--threshold=")) {
                    double threshold = Double.parseDouble(option.substring("--threshold=".length()));
                    constraints = constraints.withProbabilityThreshold(threshold);
                } else if (option.startsWith("--cache-depth=")) {
                    int cacheDepth = Integer.parseInt(option.substring("--cache-depth=".length()));
                    constraints = constraints.withCacheDepth(cacheDepth);
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            LocalGameDriver driver = new LocalGameDriver(seed);
            driver.setKeepPlaying(keepPlaying);
            ExpectimaxAI ai = new ExpectimaxAI(constraints);
            try {
                new AutoPlayer(driver, ai, constraints).playGames(gameCount);
            } finally {
                ai.shutdown();
            }
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
        }
    }

    static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Expected true or false but got: " + value);
    }

    private static void printUsage() {
        System.err.println(
                "Usage: AutoPlayerRunner <gameCount> [--mode=SEQ|PAR] [--seed=<value>] "
                        + "[--keep-playing=true|false] [--threshold=<probability>] [--cache-depth=<depth>]");
    }
}
