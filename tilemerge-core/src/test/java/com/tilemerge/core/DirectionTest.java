package com.tilemerge.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DirectionTest {

    @Test
    void enumerationOrderIsUpDownLeftRight() {
        assertEquals(Direction.UP, Direction.fromIndex(0));
        assertEquals(Direction.DOWN, Direction.fromIndex(1));
        assertEquals(Direction.LEFT, Direction.fromIndex(2));
        assertEquals(Direction.RIGHT, Direction.fromIndex(3));
        assertThrows(IllegalArgumentException.class, () -> Direction.fromIndex(4));
    }

    @Test
    void parsesNamesAndInitials() {
        assertEquals(Direction.UP, Direction.parse("up"));
        assertEquals(Direction.DOWN, Direction.parse(" D "));
        assertEquals(Direction.LEFT, Direction.parse("Left"));
        assertEquals(Direction.RIGHT, Direction.parse("r"));
        assertThrows(IllegalArgumentException.class, () -> Direction.parse("north"));
        assertThrows(IllegalArgumentException.class, () -> Direction.parse(" "));
    }

    @Test
    void mapsKeyboardKeys() {
        assertEquals(Direction.UP, Direction.fromKey('w'));
        assertEquals(Direction.LEFT, Direction.fromKey('A'));
        assertEquals(Direction.DOWN, Direction.fromKey('s'));
        assertEquals(Direction.RIGHT, Direction.fromKey('d'));
        assertThrows(IllegalArgumentException.class, () -> Direction.fromKey('x'));
    }
}
