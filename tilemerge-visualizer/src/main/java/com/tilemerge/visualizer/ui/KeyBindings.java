package com.tilemerge.visualizer.ui;

import com.tilemerge.core.Direction;
import java.util.Optional;
import javafx.scene.input.KeyCode;

/**
 * Keyboard layout for human play: arrow keys and w/a/s/d.
 */
public final class KeyBindings {

    private KeyBindings() {
    }

    public static Optional<Direction> directionFor(KeyCode code) {
        if (code == null) {
            return Optional.empty();
        }
        switch (code) {
            case UP:
            case W:
                return Optional.of(Direction.UP);
            case DOWN:
            case S:
                return Optional.of(Direction.DOWN);
            case LEFT:
            case A:
                return Optional.of(Direction.LEFT);
            case RIGHT:
            case D:
                return Optional.of(Direction.RIGHT);
            default:
                return Optional.empty();
        }
    }
}
