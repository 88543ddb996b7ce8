package com.tilemerge.core.ai.parallel;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;
import com.tilemerge.core.TilePlacement;
import com.tilemerge.core.ai.ExpectimaxEvaluator;
import com.tilemerge.core.ai.SearchConstraints;
import com.tilemerge.core.ai.SearchResult;
import com.tilemerge.core.ai.SearchScope;
import com.tilemerge.core.ai.SearchTelemetry;
import com.tilemerge.core.ai.SearchTelemetry.DirectionReport;
import com.tilemerge.core.ai.Searcher;
import com.tilemerge.core.ai.TTEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Parallel expectimax searcher. Every top-level direction runs in its own task with its own
 * {@link SearchScope}; chance nodes shallower than the split depth fork one task per inserted
 * tile and join them in placement order, deeper nodes run sequentially.
 */
public final class ForkJoinExpectimax implements Searcher {

    private static final Direction[] DIRECTIONS = Direction.values();

    private final ForkJoinPool pool;
    private final ExpectimaxEvaluator evaluator;
    private final AtomicInteger activeTasks = new AtomicInteger();
    private final AtomicLong maxActiveTasks = new AtomicLong();

    public ForkJoinExpectimax() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public ForkJoinExpectimax(int parallelism) {
        this(parallelism, new ExpectimaxEvaluator());
    }

    public ForkJoinExpectimax(int parallelism, ExpectimaxEvaluator evaluator) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.pool = new ForkJoinPool(parallelism);
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public ForkJoinExpectimax(ForkJoinPool pool, ExpectimaxEvaluator evaluator) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    /**
     * Shuts down the underlying {@link ForkJoinPool}.
     */
    public void shutdown() {
        pool.shutdown();
    }

    /**
     * Highest number of tasks observed running at the same time since construction.
     */
    public long maxActiveTasks() {
        return maxActiveTasks.get();
    }

    @Override
    public SearchResult search(BoardState state, SearchConstraints constraints) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(constraints, "constraints");
        long start = System.nanoTime();
        List<DirectionReport> reports = evaluateDirections(state, constraints);
        return SearchResult.select(new SearchTelemetry(reports, System.nanoTime() - start));
    }

    /**
     * Scores the four directions concurrently and returns the reports in enumeration order.
     */
    public List<DirectionReport> evaluateDirections(BoardState root, SearchConstraints constraints) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(constraints, "constraints");
        return pool.invoke(new RootTask(root, constraints));
    }

    private DirectionReport evaluateDirection(BoardState root, Direction direction, SearchConstraints constraints) {
        BoardState moved = root.makeMove(direction);
        if (moved.equals(root)) {
            return DirectionReport.noOp(direction);
        }
        SearchScope scope = evaluator.openScope(direction, moved, constraints);
        double score = scoreChanceNode(scope, moved, 0, 1.0, constraints.parallelSplitDepth())
                + ExpectimaxEvaluator.LEGAL_MOVE_BONUS;
        return scope.report(score);
    }

    private double scoreChanceNode(SearchScope scope, BoardState board, int depth, double probability,
            int splitDepth) {
        if (depth >= splitDepth) {
            return evaluator.scoreChanceNode(scope, board, depth, probability);
        }
        if (scope.isHorizon(depth, probability)) {
            return evaluator.leafScore(scope, board, depth);
        }
        TTEntry cached = scope.lookup(board.bits(), depth);
        if (cached != null) {
            return cached.score();
        }
        int empty = board.emptyCount();
        if (empty == 0) {
            return evaluator.leafScore(scope, board, depth);
        }

        double cellProbability = probability / empty;
        List<TilePlacement> placements = board.tilePlacements();
        List<PlacementTask> tasks = new ArrayList<>(placements.size() * 2);
        for (TilePlacement placement : placements) {
            tasks.add(new PlacementTask(scope, placement.withTwo(), depth,
                    cellProbability * ExpectimaxEvaluator.TWO_PROBABILITY, splitDepth));
            tasks.add(new PlacementTask(scope, placement.withFour(), depth,
                    cellProbability * ExpectimaxEvaluator.FOUR_PROBABILITY, splitDepth));
        }
        for (int i = tasks.size() - 1; i > 0; i--) {
            tasks.get(i).fork();
        }

        double total = 0.0;
        for (int i = 0; i < tasks.size(); i++) {
            PlacementTask task = tasks.get(i);
            double value = i == 0 ? task.compute() : task.join();
            double weight = (i & 1) == 0 ? ExpectimaxEvaluator.TWO_PROBABILITY : ExpectimaxEvaluator.FOUR_PROBABILITY;
            total += value * weight;
        }
        double score = total / empty;
        scope.store(board.bits(), depth, score);
        return score;
    }

    private double scoreMoveNode(SearchScope scope, BoardState board, int depth, double probability,
            int splitDepth) {
        double best = Double.NEGATIVE_INFINITY;
        for (Direction direction : DIRECTIONS) {
            scope.recordMoveEvaluated();
            BoardState moved = board.makeMove(direction);
            double value = moved.equals(board)
                    ? 0.0
                    : scoreChanceNode(scope, moved, depth + 1, probability, splitDepth);
            best = Math.max(best, value);
        }
        return best;
    }

    private void taskStarted() {
        int current = activeTasks.incrementAndGet();
        maxActiveTasks.accumulateAndGet(current, Math::max);
    }

    private void taskFinished() {
        activeTasks.decrementAndGet();
    }

    private final class RootTask extends RecursiveTask<List<DirectionReport>> {

        private final BoardState root;
        private final SearchConstraints constraints;

        private RootTask(BoardState root, SearchConstraints constraints) {
            this.root = root;
            this.constraints = constraints;
        }

        @Override
        protected List<DirectionReport> compute() {
            List<DirectionTask> tasks = new ArrayList<>(DIRECTIONS.length);
            for (Direction direction : DIRECTIONS) {
                DirectionTask task = new DirectionTask(root, direction, constraints);
                task.fork();
                tasks.add(task);
            }
            List<DirectionReport> reports = new ArrayList<>(DIRECTIONS.length);
            for (DirectionTask task : tasks) {
                reports.add(task.join());
            }
            return reports;
        }
    }

    private final class DirectionTask extends RecursiveTask<DirectionReport> {

        private final BoardState root;
        private final Direction direction;
        private final SearchConstraints constraints;

        private DirectionTask(BoardState root, Direction direction, SearchConstraints constraints) {
            this.root = root;
            this.direction = direction;
            this.constraints = constraints;
        }

        @Override
        protected DirectionReport compute() {
            taskStarted();
            try {
                return evaluateDirection(root, direction, constraints);
            } finally {
                taskFinished();
            }
        }
    }

    private final class PlacementTask extends RecursiveTask<Double> {

        private final SearchScope scope;
        private final BoardState board;
        private final int depth;
        private final double probability;
        private final int splitDepth;

        private PlacementTask(SearchScope scope, BoardState board, int depth, double probability, int splitDepth) {
            this.scope = scope;
            this.board = board;
            this.depth = depth;
            this.probability = probability;
            this.splitDepth = splitDepth;
        }

        @Override
        protected Double compute() {
            taskStarted();
            try {
                return scoreMoveNode(scope, board, depth, probability, splitDepth);
            } finally {
                taskFinished();
            }
        }
    }
}
