package com.tilemerge.visualizer.ui;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TilePaletteTest {

    @Test
    void tilesBeyond2048ShareOneColour() {
        assertEquals(TilePalette.background(12), TilePalette.background(15));
        assertNotEquals(TilePalette.background(11), TilePalette.background(12));
    }

    @Test
    void smallTilesUseDarkText() {
        assertEquals(TilePalette.text(1), TilePalette.text(2));
        assertNotEquals(TilePalette.text(2), TilePalette.text(3));
    }

    @Test
    void fontShrinksWithLongerNumbers() {
        assertTrue(TilePalette.fontSize(2) > TilePalette.fontSize(128));
        assertTrue(TilePalette.fontSize(128) > TilePalette.fontSize(2048));
        assertTrue(TilePalette.fontSize(2048) > TilePalette.fontSize(16384));
    }

    @Test
    void negativeExponentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TilePalette.background(-1));
    }
}
