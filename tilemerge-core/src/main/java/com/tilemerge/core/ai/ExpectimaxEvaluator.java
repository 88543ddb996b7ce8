package com.tilemerge.core.ai;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;
import com.tilemerge.core.HeuristicEvaluator;
import com.tilemerge.core.TilePlacement;
import java.util.Objects;

/**
 * Sequential expectimax recursion. Chance nodes average over every tile the game may insert,
 * move nodes take the best of the four slides.
 */
public final class ExpectimaxEvaluator {

    public static final double TWO_PROBABILITY = 0.9;
    public static final double FOUR_PROBABILITY = 0.1;
    /** Added to every legal top-level score so that a legal move always outranks a no-op. */
    public static final double LEGAL_MOVE_BONUS = 1e-6;

    private static final Direction[] DIRECTIONS = Direction.values();

    private final HeuristicEvaluator heuristic;

    public ExpectimaxEvaluator() {
        this(new HeuristicEvaluator());
    }

    public ExpectimaxEvaluator(HeuristicEvaluator heuristic) {
        this.heuristic = Objects.requireNonNull(heuristic, "heuristic");
    }

    public HeuristicEvaluator heuristic() {
        return heuristic;
    }

    /**
     * Boards with many distinct tiles are searched deeper.
     */
    public int depthLimitFor(BoardState postMove, SearchConstraints constraints) {
        return Math.max(constraints.minDepthLimit(), postMove.distinctTileCount() - 2);
    }

    /**
     * Creates a fresh scope for one top-level direction.
     */
    public SearchScope openScope(Direction direction, BoardState postMove, SearchConstraints constraints) {
        Objects.requireNonNull(postMove, "postMove");
        Objects.requireNonNull(constraints, "constraints");
        return new SearchScope(direction, depthLimitFor(postMove, constraints), constraints);
    }

    /**
     * Scores one top-level direction from the root board.
     */
    public SearchTelemetry.DirectionReport evaluateDirection(BoardState root, Direction direction,
            SearchConstraints constraints) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(direction, "direction");
        BoardState moved = root.makeMove(direction);
        if (moved.equals(root)) {
            return SearchTelemetry.DirectionReport.noOp(direction);
        }
        SearchScope scope = openScope(direction, moved, constraints);
        double score = scoreChanceNode(scope, moved, 0, 1.0) + LEGAL_MOVE_BONUS;
        return scope.report(score);
    }

    /**
     * Static score used at the search horizon.
     */
    public double leafScore(SearchScope scope, BoardState board, int depth) {
        scope.recordDepth(depth);
        return heuristic.score(board);
    }

    public double scoreChanceNode(SearchScope scope, BoardState board, int depth, double probability) {
        if (scope.isHorizon(depth, probability)) {
            return leafScore(scope, board, depth);
        }
        TTEntry cached = scope.lookup(board.bits(), depth);
        if (cached != null) {
            return cached.score();
        }
        int empty = board.emptyCount();
        if (empty == 0) {
            return leafScore(scope, board, depth);
        }
        double cellProbability = probability / empty;
        double total = 0.0;
        for (TilePlacement placement : board.tilePlacements()) {
            total += scoreMoveNode(scope, placement.withTwo(), depth, cellProbability * TWO_PROBABILITY)
                    * TWO_PROBABILITY;
            total += scoreMoveNode(scope, placement.withFour(), depth, cellProbability * FOUR_PROBABILITY)
                    * FOUR_PROBABILITY;
        }
        double score = total / empty;
        scope.store(board.bits(), depth, score);
        return score;
    }

    public double scoreMoveNode(SearchScope scope, BoardState board, int depth, double probability) {
        double best = Double.NEGATIVE_INFINITY;
        for (Direction direction : DIRECTIONS) {
            scope.recordMoveEvaluated();
            BoardState moved = board.makeMove(direction);
            double value = moved.equals(board) ? 0.0 : scoreChanceNode(scope, moved, depth + 1, probability);
            best = Math.max(best, value);
        }
        return best;
    }
}
