package com.tilemerge.core;

import java.util.Objects;

/**
 * Static board evaluation built from row table lookups: the four rows plus the four columns.
 */
public final class HeuristicEvaluator {

    private final RowTables tables;

    public HeuristicEvaluator() {
        this(RowTables.standard());
    }

    public HeuristicEvaluator(RowTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables");
    }

    public RowTables tables() {
        return tables;
    }

    public double score(BoardState state) {
        return score(Objects.requireNonNull(state, "state").bits());
    }

    public double score(long board) {
        return sumRows(board) + sumRows(BoardCodec.transpose(board));
    }

    /**
     * Returns the points a player would have collected by merging up to the tiles on this board,
     * assuming every inserted tile was a 2.
     */
    public long gameScore(long board) {
        long score = 0L;
        for (int shift = 0; shift < 64; shift += 16) {
            score += tables.mergeScore((int) ((board >>> shift) & BoardCodec.ROW_MASK));
        }
        return score;
    }

    private double sumRows(long board) {
        return tables.heuristicScore((int) (board & BoardCodec.ROW_MASK))
                + tables.heuristicScore((int) ((board >>> 16) & BoardCodec.ROW_MASK))
                + tables.heuristicScore((int) ((board >>> 32) & BoardCodec.ROW_MASK))
                + tables.heuristicScore((int) ((board >>> 48) & BoardCodec.ROW_MASK));
    }
}
