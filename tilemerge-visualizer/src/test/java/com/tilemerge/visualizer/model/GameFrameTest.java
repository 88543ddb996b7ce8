package com.tilemerge.visualizer.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;
import com.tilemerge.core.GameState;
import com.tilemerge.core.ai.SearchTelemetry;
import com.tilemerge.core.ai.SearchTelemetry.DirectionReport;
import java.util.List;
import org.junit.jupiter.api.Test;

class GameFrameTest {

    private static final GameState OPENING = GameState.of(BoardState.fromValues(new int[][]{
            {2, 0, 0, 0},
            {0, 0, 0, 0},
            {0, 0, 2, 0},
            {0, 0, 0, 0}
    }));

    @Test
    void initialFrameHasNoMoveOrSearchData() {
        GameFrame frame = GameFrame.initial(OPENING);

        assertSame(OPENING, frame.state());
        assertNull(frame.lastMove());
        assertFalse(frame.hasLastMove());
        assertFalse(frame.hasSearchData());
        assertEquals(0, frame.ply());
    }

    @Test
    void frameAfterMoveTakesPlyFromState() {
        GameState moved = OPENING.applyMove(Direction.LEFT);
        SearchTelemetry telemetry = new SearchTelemetry(
                List.of(DirectionReport.noOp(Direction.UP)), 5L);

        GameFrame frame = GameFrame.after(moved, Direction.LEFT, telemetry);

        assertEquals(1, frame.ply());
        assertEquals(Direction.LEFT, frame.lastMove());
        assertTrue(frame.hasLastMove());
        assertTrue(frame.hasSearchData());
    }

    @Test
    void missingTelemetryBecomesEmpty() {
        GameFrame frame = new GameFrame(OPENING, Direction.UP, null, 0);

        assertFalse(frame.hasSearchData());
    }

    @Test
    void frameAfterRequiresAMove() {
        assertThrows(NullPointerException.class,
                () -> GameFrame.after(OPENING, null, SearchTelemetry.empty()));
    }
}
