package com.tilemerge.core.ai;

import com.tilemerge.core.Direction;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * State owned by the evaluation of a single top-level direction: its depth limit, its private
 * transposition table and its counters. Sibling chance branches of the same direction share one
 * scope concurrently; different directions never do.
 */
public final class SearchScope {

    private final Direction direction;
    private final int depthLimit;
    private final double probabilityThreshold;
    private final int cacheDepth;
    private final TranspositionTable table;
    private final LongAdder movesEvaluated = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheStores = new LongAdder();
    private final AtomicInteger maxDepth = new AtomicInteger();
    private final long startNanos;

    public SearchScope(Direction direction, int depthLimit, SearchConstraints constraints) {
        this(direction, depthLimit, constraints, new TranspositionTable());
    }

    public SearchScope(Direction direction, int depthLimit, SearchConstraints constraints, TranspositionTable table) {
        this.direction = Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(constraints, "constraints");
        if (depthLimit < 1) {
            throw new IllegalArgumentException("Depth limit must be at least 1: " + depthLimit);
        }
        this.depthLimit = depthLimit;
        this.probabilityThreshold = constraints.probabilityThreshold();
        this.cacheDepth = constraints.cacheDepth();
        this.table = Objects.requireNonNull(table, "table");
        this.startNanos = System.nanoTime();
    }

    public Direction direction() {
        return direction;
    }

    public int depthLimit() {
        return depthLimit;
    }

    /**
     * Returns {@code true} when a chance node must be scored statically.
     */
    public boolean isHorizon(int depth, double probability) {
        return probability < probabilityThreshold || depth >= depthLimit;
    }

    /**
     * Returns the memoised score of the board at this depth, or {@code null} on a miss or when the
     * depth is not cached.
     */
    public TTEntry lookup(long board, int depth) {
        if (depth >= cacheDepth) {
            return null;
        }
        TTEntry entry = table.get(board);
        if (entry == null || entry.depth() != depth) {
            return null;
        }
        cacheHits.increment();
        return entry;
    }

    public void store(long board, int depth, double score) {
        if (depth >= cacheDepth) {
            return;
        }
        table.put(board, new TTEntry(score, depth));
        cacheStores.increment();
    }

    public void recordMoveEvaluated() {
        movesEvaluated.increment();
    }

    public void recordDepth(int depth) {
        maxDepth.accumulateAndGet(depth, Math::max);
    }

    public long movesEvaluated() {
        return movesEvaluated.sum();
    }

    public long cacheHits() {
        return cacheHits.sum();
    }

    public long cacheStores() {
        return cacheStores.sum();
    }

    public int cacheSize() {
        return table.size();
    }

    public int maxDepth() {
        return maxDepth.get();
    }

    /**
     * Snapshots the counters into a report for the provided final score.
     */
    public SearchTelemetry.DirectionReport report(double score) {
        return new SearchTelemetry.DirectionReport(direction, score, false, depthLimit, movesEvaluated(),
                cacheHits(), cacheStores(), cacheSize(), maxDepth(), System.nanoTime() - startNanos);
    }
}
