package com.tilemerge.core.ai.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;
import com.tilemerge.core.ai.ExpectimaxEvaluator;
import com.tilemerge.core.ai.SearchConstraints;
import com.tilemerge.core.ai.SearchConstraints.SearchMode;
import com.tilemerge.core.ai.SearchResult;
import com.tilemerge.core.ai.SearchTelemetry.DirectionReport;
import java.util.List;
import org.junit.jupiter.api.Test;

class ForkJoinExpectimaxTest {

    private static final BoardState BOARD = BoardState.fromValues(new int[][] {
            {2, 4, 8, 16},
            {4, 8, 16, 2},
            {2, 0, 0, 0},
            {0, 0, 0, 4}});

    @Test
    void directionScoresMatchSequentialEvaluation() {
        ExpectimaxEvaluator evaluator = new ExpectimaxEvaluator();
        SearchConstraints constraints = SearchConstraints.defaults()
                .withMode(SearchMode.PAR)
                .withProbabilityThreshold(0.0)
                .withParallelSplitDepth(2);
        ForkJoinExpectimax searcher = new ForkJoinExpectimax(4, evaluator);
        try {
            List<DirectionReport> reports = searcher.evaluateDirections(BOARD, constraints);

            assertEquals(4, reports.size());
            for (Direction direction : Direction.values()) {
                DirectionReport parallel = reports.get(direction.index());
                DirectionReport sequential = evaluator.evaluateDirection(BOARD, direction, constraints);
                assertEquals(direction, parallel.direction());
                assertEquals(sequential.noOp(), parallel.noOp());
                assertEquals(sequential.score(), parallel.score(), "Score of " + direction);
                assertEquals(sequential.depthLimit(), parallel.depthLimit());
            }
            assertTrue(searcher.maxActiveTasks() >= 1L);
        } finally {
            searcher.shutdown();
        }
    }

    @Test
    void singleWorkerPoolProducesSameSelection() {
        SearchConstraints constraints = SearchConstraints.defaults().withProbabilityThreshold(0.0);
        ForkJoinExpectimax single = new ForkJoinExpectimax(1);
        ForkJoinExpectimax wide = new ForkJoinExpectimax(4);
        try {
            SearchResult first = single.search(BOARD, constraints);
            SearchResult second = wide.search(BOARD, constraints);

            assertEquals(first.direction(), second.direction());
            assertEquals(first.score(), second.score());
        } finally {
            single.shutdown();
            wide.shutdown();
        }
    }

    @Test
    void stuckBoardYieldsTerminalResult() {
        BoardState stuck = BoardState.fromValues(new int[][] {
                {2, 4, 2, 4},
                {4, 2, 4, 2},
                {2, 4, 2, 4},
                {4, 2, 4, 2}});
        ForkJoinExpectimax searcher = new ForkJoinExpectimax(2);
        try {
            SearchResult result = searcher.search(stuck, SearchConstraints.defaults());

            assertTrue(result.terminal());
            assertEquals(Direction.UP, result.direction());
        } finally {
            searcher.shutdown();
        }
    }

    @Test
    void rejectsInvalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new ForkJoinExpectimax(0));
    }
}
