package com.tilemerge.core.driver;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;
import com.tilemerge.core.GameState;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Logger;

/**
 * In-process game backed by {@link GameState} and a seeded {@link Random}.
 */
public final class LocalGameDriver implements GameDriver {

    private static final Logger LOGGER = Logger.getLogger(LocalGameDriver.class.getName());

    private final Random random;
    private GameState state;
    private boolean keepPlaying;

    public LocalGameDriver(long seed) {
        this(new Random(seed));
    }

    public LocalGameDriver(Random random) {
        this.random = Objects.requireNonNull(random, "random");
        this.keepPlaying = true;
        this.state = GameState.newGame(random);
    }

    /**
     * Starts from a prepared state instead of a random opening.
     */
    public LocalGameDriver(Random random, GameState initial) {
        this.random = Objects.requireNonNull(random, "random");
        this.keepPlaying = true;
        this.state = Objects.requireNonNull(initial, "initial");
    }

    public GameState getState() {
        return state;
    }

    public boolean isKeepPlaying() {
        return keepPlaying;
    }

    @Override
    public BoardState readBoard() {
        return state.getBoard();
    }

    @Override
    public void makeMove(Direction direction) {
        Objects.requireNonNull(direction, "direction");
        if (isGameOver()) {
            throw new IllegalStateException("The game is over");
        }
        GameState moved = state.applyMove(direction);
        state = moved.spawnTile(random);
        if (!keepPlaying && state.hasWon()) {
            LOGGER.info(() -> String.format("Reached %d after %d moves", GameState.WINNING_TILE,
                    state.getMoveNumber()));
        }
    }

    @Override
    public long currentScore() {
        return state.getScore();
    }

    @Override
    public boolean isGameOver() {
        return state.isGameOver() || (!keepPlaying && state.hasWon());
    }

    @Override
    public void restart() {
        state = GameState.newGame(random);
        LOGGER.fine("Started a new game");
    }

    @Override
    public void setKeepPlaying(boolean keepPlaying) {
        this.keepPlaying = keepPlaying;
    }
}
