package com.tilemerge.core;

/**
 * Bit-level helpers for the packed board representation.
 * A board is a 64-bit value made of 16 nibbles in row-major order, the most significant nibble
 * holding cell (0, 0). A nibble stores the tile exponent, so {@code v} stands for the tile
 * {@code 2^v} and {@code 0} for an empty cell.
 */
public final class BoardCodec {

    public static final int SIZE = 4;
    public static final int CELL_COUNT = SIZE * SIZE;
    public static final int MAX_EXPONENT = 15;
    public static final int ROW_MASK = 0xFFFF;
    public static final int ROW_COUNT = 1 << 16;

    private static final long NIBBLE_ONES = 0x1111111111111111L;

    private BoardCodec() {
    }

    /**
     * Packs a 4x4 grid of tile exponents into a board.
     */
    public static long pack(int[][] exponents) {
        checkGrid(exponents);
        long board = 0L;
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                int exponent = exponents[row][col];
                if (exponent < 0 || exponent > MAX_EXPONENT) {
                    throw new IllegalArgumentException("Exponent out of range at (" + row + ", " + col + "): "
                            + exponent);
                }
                board |= (long) exponent << shift(row, col);
            }
        }
        return board;
    }

    /**
     * Unpacks a board into a fresh 4x4 grid of exponents.
     */
    public static int[][] unpack(long board) {
        int[][] grid = new int[SIZE][SIZE];
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                grid[row][col] = exponentAt(board, row, col);
            }
        }
        return grid;
    }

    public static int exponentAt(long board, int row, int col) {
        checkCoordinates(row, col);
        return (int) ((board >>> shift(row, col)) & 0xF);
    }

    /**
     * Returns the displayed tile value of a cell, {@code 0} when the cell is empty.
     */
    public static int valueAt(long board, int row, int col) {
        int exponent = exponentAt(board, row, col);
        return exponent == 0 ? 0 : 1 << exponent;
    }

    /**
     * Converts a displayed tile value into its exponent. Zero maps to the empty cell.
     */
    public static int exponentOf(long value) {
        if (value == 0L) {
            return 0;
        }
        if (value < 2L || Long.bitCount(value) != 1) {
            throw new IllegalArgumentException("Tile value must be 0 or a power of two >= 2: " + value);
        }
        int exponent = Long.numberOfTrailingZeros(value);
        if (exponent > MAX_EXPONENT) {
            throw new IllegalArgumentException("Tile value exceeds 2^" + MAX_EXPONENT + ": " + value);
        }
        return exponent;
    }

    /**
     * Bit offset of the nibble holding the provided cell.
     */
    public static int shift(int row, int col) {
        return (CELL_COUNT - 1 - (row * SIZE + col)) * 4;
    }

    /**
     * Bit offset of the nibble holding the provided row-major cell index.
     */
    public static int shift(int cell) {
        if (cell < 0 || cell >= CELL_COUNT) {
            throw new IllegalArgumentException("Cell index out of range: " + cell);
        }
        return (CELL_COUNT - 1 - cell) * 4;
    }

    /**
     * Returns the 16-bit row with the provided index, row 0 being the top row.
     */
    public static int row(long board, int index) {
        if (index < 0 || index >= SIZE) {
            throw new IllegalArgumentException("Row index out of range: " + index);
        }
        return (int) ((board >>> rowShift(index)) & ROW_MASK);
    }

    public static int rowShift(int index) {
        return (SIZE - 1 - index) * 16;
    }

    /**
     * Swaps rows and columns. Applying it twice yields the original board.
     */
    public static long transpose(long board) {
        long a1 = board & 0xF0F00F0FF0F00F0FL;
        long a2 = board & 0x0000F0F00000F0F0L;
        long a3 = board & 0x0F0F00000F0F0000L;
        long a = a1 | (a2 << 12) | (a3 >>> 12);
        long b1 = a & 0xFF00FF0000FF00FFL;
        long b2 = a & 0x00FF00FF00000000L;
        long b3 = a & 0x00000000FF00FF00L;
        return b1 | (b2 >>> 24) | (b3 << 24);
    }

    /**
     * Mirrors a 16-bit row so that its first cell becomes its last.
     */
    public static int reverseRow(int row) {
        return ((row >>> 12) | ((row >>> 4) & 0x00F0) | ((row << 4) & 0x0F00) | (row << 12)) & ROW_MASK;
    }

    /**
     * Counts empty cells by folding every nibble onto its lowest bit.
     */
    public static int countEmpty(long board) {
        long x = board;
        x |= (x >>> 2) & 0x3333333333333333L;
        x |= x >>> 1;
        x = ~x & NIBBLE_ONES;
        return Long.bitCount(x);
    }

    /**
     * Counts the distinct tile exponents present on the board, ignoring empty cells.
     */
    public static int countDistinctTiles(long board) {
        int seen = 0;
        long remaining = board;
        for (int i = 0; i < CELL_COUNT; i++) {
            seen |= 1 << (int) (remaining & 0xF);
            remaining >>>= 4;
        }
        return Integer.bitCount(seen >>> 1);
    }

    public static int maxExponent(long board) {
        int max = 0;
        long remaining = board;
        for (int i = 0; i < CELL_COUNT; i++) {
            max = Math.max(max, (int) (remaining & 0xF));
            remaining >>>= 4;
        }
        return max;
    }

    private static void checkGrid(int[][] grid) {
        if (grid == null || grid.length != SIZE) {
            throw new IllegalArgumentException("Grid must have " + SIZE + " rows");
        }
        for (int[] row : grid) {
            if (row == null || row.length != SIZE) {
                throw new IllegalArgumentException("Grid rows must have " + SIZE + " cells");
            }
        }
    }

    private static void checkCoordinates(int row, int col) {
        if (row < 0 || row >= SIZE || col < 0 || col >= SIZE) {
            throw new IllegalArgumentException("Cell out of range: (" + row + ", " + col + ")");
        }
    }
}
