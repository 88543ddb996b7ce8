package com.tilemerge.core;

import java.util.Objects;
import java.util.Random;

/**
 * Immutable representation of a running game: the board, the points collected so far and the
 * number of moves played.
 */
public final class GameState {

    public static final int WINNING_TILE = 2048;
    private static final int FOUR_PROBABILITY_IN_TEN = 1;

    private final BoardState board;
    private final long score;
    private final int moveNumber;
    private final int foursSpawned;

    private GameState(BoardState board, long score, int moveNumber, int foursSpawned) {
        this.board = board;
        this.score = score;
        this.moveNumber = moveNumber;
        this.foursSpawned = foursSpawned;
    }

    /**
     * Creates a fresh game with two random tiles.
     */
    public static GameState newGame(Random random) {
        Objects.requireNonNull(random, "random");
        return new GameState(BoardState.empty(), 0L, 0, 0).spawnTile(random).spawnTile(random);
    }

    public static GameState of(BoardState board) {
        return of(board, 0L, 0);
    }

    public static GameState of(BoardState board, long score, int moveNumber) {
        Objects.requireNonNull(board, "board");
        if (score < 0L) {
            throw new IllegalArgumentException("Score must not be negative: " + score);
        }
        if (moveNumber < 0) {
            throw new IllegalArgumentException("Move number must not be negative: " + moveNumber);
        }
        return new GameState(board, score, moveNumber, 0);
    }

    public BoardState getBoard() {
        return board;
    }

    public long getScore() {
        return score;
    }

    public int getMoveNumber() {
        return moveNumber;
    }

    /**
     * Number of 4-tiles the game has inserted so far.
     */
    public int getFoursSpawned() {
        return foursSpawned;
    }

    public int getMaxTile() {
        return board.maxTile();
    }

    /**
     * Returns {@code true} once no direction changes the board.
     */
    public boolean isGameOver() {
        return board.isStuck();
    }

    public boolean hasWon() {
        return board.maxTile() >= WINNING_TILE;
    }

    /**
     * Slides the board and adds the merge points to the score. No tile is inserted; call
     * {@link #spawnTile(Random)} to complete the turn.
     */
    public GameState applyMove(Direction direction) {
        Objects.requireNonNull(direction, "direction");
        if (isGameOver()) {
            throw new IllegalStateException("Cannot move on a finished game");
        }
        BoardState moved = board.makeMove(direction);
        if (moved.equals(board)) {
            throw new IllegalArgumentException("Move " + direction + " does not change the board");
        }
        HeuristicEvaluator evaluator = new HeuristicEvaluator(board.tables());
        long gained = evaluator.gameScore(moved.bits()) - evaluator.gameScore(board.bits());
        return new GameState(moved, score + gained, moveNumber + 1, foursSpawned);
    }

    /**
     * Inserts a 2 (nine times out of ten) or a 4 into a uniformly chosen empty cell.
     */
    public GameState spawnTile(Random random) {
        Objects.requireNonNull(random, "random");
        int empty = board.emptyCount();
        if (empty == 0) {
            throw new IllegalStateException("No empty cell to place a tile");
        }
        int target = random.nextInt(empty);
        boolean four = random.nextInt(10) < FOUR_PROBABILITY_IN_TEN;
        for (int cell = 0; cell < BoardCodec.CELL_COUNT; cell++) {
            if (!board.isEmpty(cell)) {
                continue;
            }
            if (target == 0) {
                return new GameState(board.withTile(cell, four ? 2 : 1), score, moveNumber,
                        four ? foursSpawned + 1 : foursSpawned);
            }
            target--;
        }
        throw new IllegalStateException("Empty cell count does not match the board");
    }

    @Override
    public String toString() {
        return String.format("Move %d, score %d%n%s", moveNumber, score, board);
    }
}
