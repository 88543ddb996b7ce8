package com.tilemerge.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;
import com.tilemerge.core.ai.SearchConstraints.SearchMode;
import com.tilemerge.core.ai.SearchTelemetry.DirectionReport;
import org.junit.jupiter.api.Test;

class ExpectimaxAITest {

    private static final SearchConstraints SEQUENTIAL = SearchConstraints.defaults().withMode(SearchMode.SEQ);

    private static final BoardState OPENING = BoardState.fromValues(new int[][] {
            {2, 0, 0, 0},
            {0, 0, 4, 0},
            {0, 0, 0, 0},
            {0, 2, 0, 0}});

    private static final BoardState CROWDED = BoardState.fromValues(new int[][] {
            {2, 4, 8, 16},
            {4, 8, 16, 2},
            {2, 0, 0, 0},
            {0, 0, 0, 4}});

    @Test
    void repeatedSequentialSearchesAgree() {
        ExpectimaxAI ai = new ExpectimaxAI(SEQUENTIAL);

        SearchResult first = ai.search(OPENING, SEQUENTIAL);
        SearchResult second = ai.search(OPENING, SEQUENTIAL);

        assertEquals(first.direction(), second.direction());
        assertEquals(first.score(), second.score());
        assertEquals(first.direction(), ai.findBestMove(OPENING));
        assertSame(ai.getLastResult().direction(), first.direction());
    }

    @Test
    void cacheDoesNotChangeScores() {
        SearchConstraints exact = SEQUENTIAL.withProbabilityThreshold(0.0);
        ExpectimaxAI ai = new ExpectimaxAI(exact);

        SearchResult cached = ai.search(CROWDED, exact);
        SearchResult uncached = ai.search(CROWDED, exact.withCacheDepth(0));

        for (Direction direction : Direction.values()) {
            DirectionReport withCache = cached.telemetry().report(direction);
            DirectionReport withoutCache = uncached.telemetry().report(direction);
            assertEquals(withoutCache.score(), withCache.score(), "Score of " + direction);
            assertEquals(0L, withoutCache.cacheHits());
            assertEquals(0, withoutCache.cacheSize());
        }
        assertTrue(cached.telemetry().totalCacheStores() > 0L);
        assertEquals(uncached.direction(), cached.direction());
    }

    @Test
    void stuckBoardIsTerminal() {
        BoardState stuck = BoardState.fromValues(new int[][] {
                {2, 4, 2, 4},
                {4, 2, 4, 2},
                {2, 4, 2, 4},
                {4, 2, 4, 2}});

        SearchResult result = new ExpectimaxAI(SEQUENTIAL).search(stuck, SEQUENTIAL);

        assertTrue(result.terminal());
        assertEquals(Direction.UP, result.direction());
        assertEquals(0.0, result.score());
        assertTrue(result.telemetry().directions().stream().allMatch(DirectionReport::noOp));
    }

    @Test
    void onlyLegalMoveIsSelected() {
        BoardState state = BoardState.fromValues(new int[][] {
                {2, 4, 8, 16},
                {4, 8, 16, 2},
                {0, 0, 0, 0},
                {0, 0, 0, 0}});

        SearchResult result = new ExpectimaxAI(SEQUENTIAL).search(state, SEQUENTIAL);

        assertFalse(result.terminal());
        assertEquals(Direction.DOWN, result.direction());
        assertTrue(result.telemetry().report(Direction.UP).noOp());
        assertTrue(result.telemetry().report(Direction.LEFT).noOp());
        assertTrue(result.telemetry().report(Direction.RIGHT).noOp());
        assertTrue(result.score() > 0.0);
    }

    @Test
    void telemetryReportsPerDirectionWork() {
        SearchResult result = new ExpectimaxAI(SEQUENTIAL).search(OPENING, SEQUENTIAL);

        assertEquals(4, result.telemetry().directions().size());
        for (DirectionReport report : result.telemetry().directions()) {
            if (report.noOp()) {
                continue;
            }
            assertTrue(report.movesEvaluated() > 0L);
            assertTrue(report.depthLimit() >= SearchConstraints.DEFAULT_MIN_DEPTH_LIMIT);
            assertTrue(report.maxDepth() >= 1 && report.maxDepth() <= report.depthLimit());
        }
        assertTrue(result.telemetry().totalMovesEvaluated() > 0L);
    }

    @Test
    void parallelModeMatchesSequentialSelection() {
        SearchConstraints exact = SEQUENTIAL.withProbabilityThreshold(0.0);
        ExpectimaxAI ai = new ExpectimaxAI(exact);
        try {
            SearchResult sequential = ai.search(CROWDED, exact);
            SearchResult parallel = ai.search(CROWDED, exact.withMode(SearchMode.PAR));

            assertEquals(sequential.direction(), parallel.direction());
            assertEquals(sequential.score(), parallel.score());
        } finally {
            ai.shutdown();
        }
    }
}
