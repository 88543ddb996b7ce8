package com.tilemerge.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable value wrapper around a packed board.
 * Equality and hashing are defined by the packed bits only, so two states with the same tiles are
 * interchangeable as cache keys.
 */
public final class BoardState {

    private static final BoardState EMPTY = new BoardState(0L, RowTables.standard());

    private final long bits;
    private final RowTables tables;

    private BoardState(long bits, RowTables tables) {
        this.bits = bits;
        this.tables = tables;
    }

    public static BoardState empty() {
        return EMPTY;
    }

    /**
     * Wraps an already packed board.
     */
    public static BoardState of(long bits) {
        return new BoardState(bits, RowTables.standard());
    }

    public static BoardState of(long bits, RowTables tables) {
        return new BoardState(bits, Objects.requireNonNull(tables, "tables"));
    }

    /**
     * Builds a state from a grid of tile exponents ({@code 0} for empty cells).
     */
    public static BoardState fromExponents(int[][] exponents) {
        return of(BoardCodec.pack(exponents));
    }

    /**
     * Builds a state from a grid of displayed tile values. Every value must be {@code 0} or a power
     * of two between 2 and 2^15.
     */
    public static BoardState fromValues(long[][] values) {
        if (values == null || values.length != BoardCodec.SIZE) {
            throw new IllegalArgumentException("Grid must have " + BoardCodec.SIZE + " rows");
        }
        int[][] exponents = new int[BoardCodec.SIZE][BoardCodec.SIZE];
        for (int row = 0; row < BoardCodec.SIZE; row++) {
            if (values[row] == null || values[row].length != BoardCodec.SIZE) {
                throw new IllegalArgumentException("Grid rows must have " + BoardCodec.SIZE + " cells");
            }
            for (int col = 0; col < BoardCodec.SIZE; col++) {
                exponents[row][col] = BoardCodec.exponentOf(values[row][col]);
            }
        }
        return fromExponents(exponents);
    }

    public static BoardState fromValues(int[][] values) {
        if (values == null) {
            throw new IllegalArgumentException("Grid must not be null");
        }
        long[][] widened = new long[values.length][];
        for (int row = 0; row < values.length; row++) {
            if (values[row] == null) {
                throw new IllegalArgumentException("Grid rows must not be null");
            }
            widened[row] = new long[values[row].length];
            for (int col = 0; col < values[row].length; col++) {
                widened[row][col] = values[row][col];
            }
        }
        return fromValues(widened);
    }

    public long bits() {
        return bits;
    }

    public RowTables tables() {
        return tables;
    }

    /**
     * Applies a slide. The returned state equals this one when the move changes nothing.
     */
    public BoardState makeMove(Direction direction) {
        long moved = tables.move(bits, Objects.requireNonNull(direction, "direction"));
        return moved == bits ? this : new BoardState(moved, tables);
    }

    public boolean canMove(Direction direction) {
        return tables.move(bits, Objects.requireNonNull(direction, "direction")) != bits;
    }

    /**
     * Returns the directions that change the board, in enumeration order.
     */
    public Set<Direction> legalMoves() {
        Set<Direction> moves = EnumSet.noneOf(Direction.class);
        for (Direction direction : Direction.values()) {
            if (canMove(direction)) {
                moves.add(direction);
            }
        }
        return moves;
    }

    /**
     * Returns {@code true} when no direction changes the board.
     */
    public boolean isStuck() {
        for (Direction direction : Direction.values()) {
            if (canMove(direction)) {
                return false;
            }
        }
        return true;
    }

    public BoardState transpose() {
        return new BoardState(BoardCodec.transpose(bits), tables);
    }

    public int emptyCount() {
        return BoardCodec.countEmpty(bits);
    }

    public int distinctTileCount() {
        return BoardCodec.countDistinctTiles(bits);
    }

    /**
     * Returns the largest displayed tile value, {@code 0} for an empty board.
     */
    public int maxTile() {
        int exponent = BoardCodec.maxExponent(bits);
        return exponent == 0 ? 0 : 1 << exponent;
    }

    public int exponentAt(int row, int col) {
        return BoardCodec.exponentAt(bits, row, col);
    }

    public int tileAt(int row, int col) {
        return BoardCodec.valueAt(bits, row, col);
    }

    public boolean isEmpty(int cell) {
        return ((bits >>> BoardCodec.shift(cell)) & 0xF) == 0;
    }

    /**
     * Places a tile with the provided exponent into an empty cell.
     */
    public BoardState withTile(int cell, int exponent) {
        if (exponent < 1 || exponent > BoardCodec.MAX_EXPONENT) {
            throw new IllegalArgumentException("Exponent out of range: " + exponent);
        }
        if (!isEmpty(cell)) {
            throw new IllegalArgumentException("Cell " + cell + " is already occupied");
        }
        return new BoardState(bits | ((long) exponent << BoardCodec.shift(cell)), tables);
    }

    /**
     * Enumerates every way the game can insert a new tile: one entry per empty cell, in row-major
     * order, holding the board with a 2 and the board with a 4 in that cell.
     */
    public List<TilePlacement> tilePlacements() {
        List<TilePlacement> placements = new ArrayList<>(emptyCount());
        for (int cell = 0; cell < BoardCodec.CELL_COUNT; cell++) {
            int shift = BoardCodec.shift(cell);
            if (((bits >>> shift) & 0xF) != 0) {
                continue;
            }
            BoardState withTwo = new BoardState(bits | (1L << shift), tables);
            BoardState withFour = new BoardState(bits | (2L << shift), tables);
            placements.add(new TilePlacement(cell, withTwo, withFour));
        }
        return Collections.unmodifiableList(placements);
    }

    /**
     * Returns the four rows as 16-bit values, top row first.
     */
    public int[] rows() {
        int[] rows = new int[BoardCodec.SIZE];
        for (int i = 0; i < BoardCodec.SIZE; i++) {
            rows[i] = BoardCodec.row(bits, i);
        }
        return rows;
    }

    public int[][] toExponents() {
        return BoardCodec.unpack(bits);
    }

    /**
     * Returns the displayed tile values as a fresh grid.
     */
    public int[][] toGrid() {
        int[][] grid = new int[BoardCodec.SIZE][BoardCodec.SIZE];
        for (int row = 0; row < BoardCodec.SIZE; row++) {
            for (int col = 0; col < BoardCodec.SIZE; col++) {
                grid[row][col] = tileAt(row, col);
            }
        }
        return grid;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BoardState)) {
            return false;
        }
        return bits == ((BoardState) other).bits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < BoardCodec.SIZE; row++) {
            for (int col = 0; col < BoardCodec.SIZE; col++) {
                int value = tileAt(row, col);
                builder.append('|').append(String.format("%6s", value == 0 ? "" : Integer.toString(value)));
            }
            builder.append('|');
            if (row < BoardCodec.SIZE - 1) {
                builder.append(System.lineSeparator());
            }
        }
        return builder.toString();
    }
}
