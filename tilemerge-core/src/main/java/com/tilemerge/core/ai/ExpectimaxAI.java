package com.tilemerge.core.ai;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;
import com.tilemerge.core.ai.SearchTelemetry.DirectionReport;
import com.tilemerge.core.ai.parallel.ForkJoinExpectimax;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Expectimax move selector. Runs the four top-level directions sequentially or through
 * {@link ForkJoinExpectimax} depending on the requested mode.
 */
public final class ExpectimaxAI implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(ExpectimaxAI.class.getName());

    private final ExpectimaxEvaluator evaluator;
    private final SearchConstraints constraints;
    private ForkJoinExpectimax parallelSearcher;
    private volatile SearchResult lastResult;

    public ExpectimaxAI() {
        this(SearchConstraints.defaults());
    }

    public ExpectimaxAI(SearchConstraints constraints) {
        this(new ExpectimaxEvaluator(), constraints);
    }

    public ExpectimaxAI(ExpectimaxEvaluator evaluator, SearchConstraints constraints) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
    }

    public SearchConstraints getConstraints() {
        return constraints;
    }

    /**
     * Returns the direction chosen with the configured constraints.
     */
    public Direction findBestMove(BoardState state) {
        return search(state, constraints).direction();
    }

    public SearchResult getLastResult() {
        return lastResult;
    }

    @Override
    public SearchResult search(BoardState state, SearchConstraints constraints) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(constraints, "constraints");

        long start = System.nanoTime();
        List<DirectionReport> reports;
        if (constraints.mode() == SearchConstraints.SearchMode.SEQ) {
            reports = new ArrayList<>(Direction.values().length);
            for (Direction direction : Direction.values()) {
                reports.add(evaluator.evaluateDirection(state, direction, constraints));
            }
        } else {
            reports = getParallelSearcher().evaluateDirections(state, constraints);
        }
        SearchResult result = SearchResult.select(new SearchTelemetry(reports, System.nanoTime() - start));

        for (DirectionReport report : reports) {
            logDirection(report);
        }
        if (result.terminal()) {
            LOGGER.info("No direction changes the board");
        } else {
            SearchTelemetry telemetry = result.telemetry();
            LOGGER.info(() -> String.format("Selected %s (score %.2f, %d moves evaluated in %.1f ms, mode=%s)",
                    result.direction(), result.score(), telemetry.totalMovesEvaluated(), telemetry.elapsedMillis(),
                    constraints.mode()));
        }
        lastResult = result;
        return result;
    }

    /**
     * Releases the worker pool used for parallel searches, if one was created.
     */
    public synchronized void shutdown() {
        if (parallelSearcher != null) {
            parallelSearcher.shutdown();
            parallelSearcher = null;
        }
    }

    private synchronized ForkJoinExpectimax getParallelSearcher() {
        if (parallelSearcher == null) {
            parallelSearcher = new ForkJoinExpectimax(Runtime.getRuntime().availableProcessors(), evaluator);
        }
        return parallelSearcher;
    }

    private static void logDirection(DirectionReport report) {
        if (report.noOp()) {
            LOGGER.fine(() -> String.format("Move %s: no-op", report.direction()));
            return;
        }
        LOGGER.fine(() -> String.format(
                "Move %s: result %.2f: eval'd %d moves (%d cache hits, %d cache size) in %.1f ms (maxdepth=%d)",
                report.direction(), report.score(), report.movesEvaluated(), report.cacheHits(), report.cacheSize(),
                report.elapsedMillis(), report.maxDepth()));
    }
}
