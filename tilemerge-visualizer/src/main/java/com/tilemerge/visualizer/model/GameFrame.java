package com.tilemerge.visualizer.model;

import com.tilemerge.core.Direction;
import com.tilemerge.core.GameState;
import com.tilemerge.core.ai.SearchTelemetry;
import java.util.Objects;

/**
 * Snapshot of a single position within a recorded game.
 *
 * @param state     the game after the move and the inserted tile
 * @param lastMove  the move that led here, {@code null} for the opening position
 * @param telemetry instrumentation of the search that chose the move, empty for human moves
 * @param ply       number of moves played
 */
public record GameFrame(GameState state, Direction lastMove, SearchTelemetry telemetry, int ply) {

    public GameFrame {
        Objects.requireNonNull(state, "state");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public static GameFrame initial(GameState state) {
        Objects.requireNonNull(state, "state");
        return new GameFrame(state, null, SearchTelemetry.empty(), state.getMoveNumber());
    }

    /**
     * Frame for the state reached by the provided move.
     */
    public static GameFrame after(GameState state, Direction move, SearchTelemetry telemetry) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(move, "move");
        return new GameFrame(state, move, telemetry, state.getMoveNumber());
    }

    public boolean hasLastMove() {
        return lastMove != null;
    }

    public boolean hasSearchData() {
        return !telemetry.directions().isEmpty();
    }
}
