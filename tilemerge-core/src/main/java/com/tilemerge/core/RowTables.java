package com.tilemerge.core;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Precomputed slide results and heuristic scores for all 65536 possible rows.
 * Moves are stored as XOR deltas so that {@code row ^ delta} yields the row after the slide;
 * a slide that changes nothing has a delta of zero. Instances are immutable once constructed
 * and can be shared freely between threads.
 */
public final class RowTables {

    private static final Logger LOGGER = Logger.getLogger(RowTables.class.getName());

    private final HeuristicWeights weights;
    private final int[] rightDeltas = new int[BoardCodec.ROW_COUNT];
    private final int[] leftDeltas = new int[BoardCodec.ROW_COUNT];
    private final double[] heuristicScores = new double[BoardCodec.ROW_COUNT];
    private final int[] mergeScores = new int[BoardCodec.ROW_COUNT];

    public RowTables(HeuristicWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
        long start = System.nanoTime();
        int[] line = new int[BoardCodec.SIZE];
        for (int row = 0; row < BoardCodec.ROW_COUNT; row++) {
            split(row, line);
            heuristicScores[row] = scoreRow(line, weights);
            mergeScores[row] = mergeScore(line);

            int rightResult = slideRight(line);
            rightDeltas[row] = row ^ rightResult;

            int reversed = BoardCodec.reverseRow(row);
            split(reversed, line);
            int leftResult = BoardCodec.reverseRow(slideRight(line));
            leftDeltas[row] = row ^ leftResult;
        }
        long elapsed = System.nanoTime() - start;
        LOGGER.fine(() -> String.format("Built row tables for %d rows in %.1f ms", BoardCodec.ROW_COUNT,
                elapsed / 1_000_000.0));
    }

    /**
     * Returns the shared tables built from {@link HeuristicWeights#DEFAULT}.
     */
    public static RowTables standard() {
        return StandardHolder.INSTANCE;
    }

    public HeuristicWeights weights() {
        return weights;
    }

    public int rightDelta(int row) {
        return rightDeltas[row & BoardCodec.ROW_MASK];
    }

    public int leftDelta(int row) {
        return leftDeltas[row & BoardCodec.ROW_MASK];
    }

    public double heuristicScore(int row) {
        return heuristicScores[row & BoardCodec.ROW_MASK];
    }

    /**
     * Points collected by merging up to the tiles of this row, starting from 2-tiles.
     */
    public int mergeScore(int row) {
        return mergeScores[row & BoardCodec.ROW_MASK];
    }

    public long moveRight(long board) {
        return applyRows(board, rightDeltas);
    }

    public long moveLeft(long board) {
        return applyRows(board, leftDeltas);
    }

    public long moveDown(long board) {
        return BoardCodec.transpose(applyRows(BoardCodec.transpose(board), rightDeltas));
    }

    public long moveUp(long board) {
        return BoardCodec.transpose(applyRows(BoardCodec.transpose(board), leftDeltas));
    }

    public long move(long board, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        switch (direction) {
            case UP:
                return moveUp(board);
            case DOWN:
                return moveDown(board);
            case LEFT:
                return moveLeft(board);
            case RIGHT:
                return moveRight(board);
            default:
                throw new IllegalArgumentException("Unsupported direction: " + direction);
        }
    }

    private static long applyRows(long board, int[] deltas) {
        long result = board;
        for (int shift = 0; shift < 64; shift += 16) {
            int row = (int) ((board >>> shift) & BoardCodec.ROW_MASK);
            result ^= (long) deltas[row] << shift;
        }
        return result;
    }

    private static void split(int row, int[] line) {
        line[0] = (row >>> 12) & 0xF;
        line[1] = (row >>> 8) & 0xF;
        line[2] = (row >>> 4) & 0xF;
        line[3] = row & 0xF;
    }

    private static int join(int[] line) {
        return (line[0] << 12) | (line[1] << 8) | (line[2] << 4) | line[3];
    }

    /**
     * Slides the cells towards index 3, merging equal neighbours at most once per cell.
     * The array is modified in place.
     */
    static int slideRight(int[] line) {
        int i = BoardCodec.SIZE - 1;
        while (i > 0) {
            int j = i - 1;
            while (j >= 0 && line[j] == 0) {
                j--;
            }
            if (j < 0) {
                break;
            }
            if (line[i] == 0) {
                line[i] = line[j];
                line[j] = 0;
                // the moved tile may still merge with the next one on its left
                continue;
            }
            if (line[i] == line[j] && line[i] != BoardCodec.MAX_EXPONENT) {
                line[i]++;
                line[j] = 0;
            }
            i--;
        }
        return join(line);
    }

    static double scoreRow(int[] line, HeuristicWeights weights) {
        double sum = 0.0;
        int empty = 0;
        int merges = 0;
        int previous = 0;
        int run = 0;
        for (int rank : line) {
            if (rank == 0) {
                empty++;
                continue;
            }
            sum += Math.pow(rank, weights.sumPower());
            if (previous == rank) {
                run++;
            } else if (run > 0) {
                merges += 1 + run;
                run = 0;
            }
            previous = rank;
        }
        if (run > 0) {
            merges += 1 + run;
        }

        double monotonicityLeft = 0.0;
        double monotonicityRight = 0.0;
        for (int i = 1; i < line.length; i++) {
            double before = Math.pow(line[i - 1], weights.monotonicityPower());
            double after = Math.pow(line[i], weights.monotonicityPower());
            if (line[i - 1] > line[i]) {
                monotonicityLeft += before - after;
            } else {
                monotonicityRight += after - before;
            }
        }

        return weights.lostPenalty()
                + weights.emptyWeight() * empty
                + weights.mergesWeight() * merges
                - weights.monotonicityWeight() * Math.min(monotonicityLeft, monotonicityRight)
                - weights.sumWeight() * sum;
    }

    private static int mergeScore(int[] line) {
        int score = 0;
        for (int rank : line) {
            if (rank >= 2) {
                score += (rank - 1) * (1 << rank);
            }
        }
        return score;
    }

    private static final class StandardHolder {
        private static final RowTables INSTANCE = new RowTables(HeuristicWeights.DEFAULT);
    }
}
