package com.tilemerge.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HeuristicEvaluatorTest {

    private final HeuristicEvaluator evaluator = new HeuristicEvaluator();

    @Test
    void scoresRowsAndColumns() {
        BoardState state = BoardState.fromValues(new int[][] {
                {2, 0, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 0}});

        assertEquals(2 * 200799.0 + 6 * 201080.0, evaluator.score(state), 1e-6);
        assertEquals(8 * 201080.0, evaluator.score(BoardState.empty()), 1e-6);
    }

    @Test
    void prefersBoardWithMoreEmptyCells() {
        BoardState sparse = BoardState.fromValues(new int[][] {
                {2, 0, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 0}});
        BoardState crowded = BoardState.fromValues(new int[][] {
                {2, 0, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 2}});

        assertTrue(evaluator.score(sparse) >= evaluator.score(crowded));
    }

    @Test
    void scoreIsSymmetricUnderTranspose() {
        BoardState state = BoardState.fromValues(new int[][] {
                {2, 4, 8, 16},
                {0, 2, 0, 32},
                {0, 0, 4, 0},
                {0, 0, 0, 2}});

        assertEquals(evaluator.score(state), evaluator.score(state.transpose()), 1e-6);
    }

    @Test
    void gameScoreSumsMergePoints() {
        BoardState state = BoardState.fromValues(new int[][] {
                {2, 4, 0, 0},
                {0, 0, 8, 0},
                {0, 0, 0, 0},
                {0, 0, 0, 2048}});

        assertEquals(4 + 16 + 10 * 2048, evaluator.gameScore(state.bits()));
    }
}
