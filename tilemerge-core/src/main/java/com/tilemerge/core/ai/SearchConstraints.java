package com.tilemerge.core.ai;

import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param probabilityThreshold chance nodes reached with a lower cumulative probability are scored
 *                             statically
 * @param cacheDepth           chance nodes shallower than this depth are memoised; {@code 0}
 *                             disables the cache
 * @param minDepthLimit        lower bound of the adaptive depth limit
 * @param parallelSplitDepth   chance nodes shallower than this depth fork one task per tile
 *                             placement when running in {@link SearchMode#PAR}
 * @param mode                 execution strategy
 */
public record SearchConstraints(double probabilityThreshold, int cacheDepth, int minDepthLimit,
        int parallelSplitDepth, SearchMode mode) {

    public static final double DEFAULT_PROBABILITY_THRESHOLD = 1e-4;
    public static final int DEFAULT_CACHE_DEPTH = 6;
    public static final int DEFAULT_MIN_DEPTH_LIMIT = 3;
    public static final int DEFAULT_PARALLEL_SPLIT_DEPTH = 1;

    private static final SearchConstraints DEFAULTS = new SearchConstraints(DEFAULT_PROBABILITY_THRESHOLD,
            DEFAULT_CACHE_DEPTH, DEFAULT_MIN_DEPTH_LIMIT, DEFAULT_PARALLEL_SPLIT_DEPTH, SearchMode.PAR);

    public SearchConstraints {
        Objects.requireNonNull(mode, "mode");
        if (!(probabilityThreshold >= 0.0) || probabilityThreshold > 1.0) {
            throw new IllegalArgumentException("probabilityThreshold must be within [0, 1]: " + probabilityThreshold);
        }
        if (cacheDepth < 0) {
            throw new IllegalArgumentException("cacheDepth must not be negative: " + cacheDepth);
        }
        if (minDepthLimit < 1) {
            throw new IllegalArgumentException("minDepthLimit must be at least 1: " + minDepthLimit);
        }
        if (parallelSplitDepth < 0) {
            throw new IllegalArgumentException("parallelSplitDepth must not be negative: " + parallelSplitDepth);
        }
    }

    public static SearchConstraints defaults() {
        return DEFAULTS;
    }

    public SearchConstraints withMode(SearchMode mode) {
        return new SearchConstraints(probabilityThreshold, cacheDepth, minDepthLimit, parallelSplitDepth, mode);
    }

    public SearchConstraints withProbabilityThreshold(double probabilityThreshold) {
        return new SearchConstraints(probabilityThreshold, cacheDepth, minDepthLimit, parallelSplitDepth, mode);
    }

    public SearchConstraints withCacheDepth(int cacheDepth) {
        return new SearchConstraints(probabilityThreshold, cacheDepth, minDepthLimit, parallelSplitDepth, mode);
    }

    public SearchConstraints withMinDepthLimit(int minDepthLimit) {
        return new SearchConstraints(probabilityThreshold, cacheDepth, minDepthLimit, parallelSplitDepth, mode);
    }

    public SearchConstraints withParallelSplitDepth(int parallelSplitDepth) {
        return new SearchConstraints(probabilityThreshold, cacheDepth, minDepthLimit, parallelSplitDepth, mode);
    }

    /**
     * Execution strategy hint for {@link Searcher} implementations.
     */
    public enum SearchMode {
        SEQ,
        PAR
    }
}
