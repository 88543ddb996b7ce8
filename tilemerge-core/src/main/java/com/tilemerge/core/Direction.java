package com.tilemerge.core;

import java.util.Locale;

/**
 * The four slide directions. The declaration order is the order in which the search enumerates
 * moves and therefore decides ties.
 */
public enum Direction {
    UP('↑'),
    DOWN('↓'),
    LEFT('←'),
    RIGHT('→');

    private static final Direction[] VALUES = values();

    private final char symbol;

    Direction(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public int index() {
        return ordinal();
    }

    /**
     * Returns the direction with the provided enumeration index.
     */
    public static Direction fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            throw new IllegalArgumentException("Direction index out of range: " + index);
        }
        return VALUES[index];
    }

    /**
     * Parses a direction from its name or its first letter.
     */
    public static Direction parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Direction must not be empty");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "u", "up":
                return UP;
            case "d", "down":
                return DOWN;
            case "l", "left":
                return LEFT;
            case "r", "right":
                return RIGHT;
            default:
                throw new IllegalArgumentException("Unknown direction: " + text);
        }
    }

    /**
     * Maps the {@code w/a/s/d} keyboard layout to a direction.
     */
    public static Direction fromKey(char key) {
        switch (Character.toLowerCase(key)) {
            case 'w':
                return UP;
            case 's':
                return DOWN;
            case 'a':
                return LEFT;
            case 'd':
                return RIGHT;
            default:
                throw new IllegalArgumentException("Unmapped key: " + key);
        }
    }
}
