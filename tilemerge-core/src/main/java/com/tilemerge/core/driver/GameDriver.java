package com.tilemerge.core.driver;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;

/**
 * Connection to a running game: reads the board and actuates the chosen moves.
 */
public interface GameDriver {

    BoardState readBoard();

    /**
     * Plays one move, including the tile the game inserts afterwards.
     *
     * @throws IllegalArgumentException if the move does not change the board
     * @throws IllegalStateException    if the game is over
     */
    void makeMove(Direction direction);

    long currentScore();

    boolean isGameOver();

    /**
     * Starts a new game.
     */
    void restart();

    /**
     * Controls whether the game continues after the winning tile appears.
     */
    void setKeepPlaying(boolean keepPlaying);
}
