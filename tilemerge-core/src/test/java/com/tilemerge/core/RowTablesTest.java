package com.tilemerge.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RowTablesTest {

    private final RowTables tables = RowTables.standard();

    @Test
    void mergesPairSeparatedByGapWhenMovingRight() {
        assertEquals(row(0, 0, 0, 2), moveRight(row(1, 0, 0, 1)));
    }

    @Test
    void mergesTwoPairsIndependentlyWhenMovingLeft() {
        assertEquals(row(2, 2, 0, 0), moveLeft(row(1, 1, 1, 1)));
    }

    @Test
    void packedRowWithoutPairsIsUnchanged() {
        int packed = row(1, 2, 1, 2);
        assertEquals(0, tables.rightDelta(packed));
        assertEquals(0, tables.leftDelta(packed));
    }

    @Test
    void mergedTileDoesNotMergeAgain() {
        assertEquals(row(0, 0, 2, 2), moveRight(row(2, 1, 1, 0)));
        assertEquals(row(0, 0, 1, 2), moveRight(row(1, 1, 1, 0)));
    }

    @Test
    void largestTilesNeverMerge() {
        assertEquals(row(0, 0, 15, 15), moveRight(row(15, 15, 0, 0)));
        assertEquals(0, tables.leftDelta(row(15, 15, 0, 0)));
    }

    @Test
    void verticalMovesMatchTransposedHorizontalMoves() {
        long board = BoardCodec.pack(new int[][] {
                {1, 0, 2, 3},
                {1, 0, 0, 3},
                {0, 4, 2, 0},
                {2, 4, 0, 1}});

        long up = tables.moveUp(board);

        assertEquals(BoardCodec.pack(new int[][] {
                {2, 5, 3, 4},
                {2, 0, 0, 1},
                {0, 0, 0, 0},
                {0, 0, 0, 0}}), up);
        assertEquals(BoardCodec.transpose(tables.moveRight(BoardCodec.transpose(board))), tables.moveDown(board));
    }

    @Test
    void noOpMoveStaysNoOp() {
        long board = BoardCodec.pack(new int[][] {
                {1, 2, 3, 4},
                {0, 0, 0, 5},
                {0, 0, 0, 0},
                {0, 0, 0, 0}});
        for (Direction direction : Direction.values()) {
            long moved = tables.move(board, direction);
            assertEquals(moved, tables.move(moved, direction), "Second " + direction + " should change nothing");
        }
        assertEquals(board, tables.moveRight(board));
    }

    @Test
    void heuristicScoresEmptyAndSingleTileRows() {
        assertEquals(201080.0, tables.heuristicScore(0), 1e-9);
        assertEquals(200799.0, tables.heuristicScore(row(1, 0, 0, 0)), 1e-9);
    }

    @Test
    void heuristicRewardsMergeableNeighbours() {
        assertTrue(tables.heuristicScore(row(1, 1, 0, 0)) > tables.heuristicScore(row(1, 0, 0, 0)));
        assertTrue(tables.heuristicScore(row(3, 3, 0, 0)) > tables.heuristicScore(row(3, 2, 0, 0)));
    }

    @Test
    void mergeScoreCountsPointsCollectedUpToEachTile() {
        assertEquals(0, tables.mergeScore(row(1, 1, 0, 0)));
        assertEquals(4, tables.mergeScore(row(2, 0, 0, 0)));
        assertEquals(16 + 4, tables.mergeScore(row(3, 0, 2, 0)));
    }

    @Test
    void standardTablesAreShared() {
        assertSame(RowTables.standard(), tables);
        assertSame(HeuristicWeights.DEFAULT, tables.weights());
    }

    private int moveRight(int row) {
        return row ^ tables.rightDelta(row);
    }

    private int moveLeft(int row) {
        return row ^ tables.leftDelta(row);
    }

    private static int row(int a, int b, int c, int d) {
        return (a << 12) | (b << 8) | (c << 4) | d;
    }
}
