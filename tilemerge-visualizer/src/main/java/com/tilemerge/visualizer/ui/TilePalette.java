package com.tilemerge.visualizer.ui;

import javafx.scene.paint.Color;

/**
 * Tile colours indexed by exponent.
 */
public final class TilePalette {

    private static final Color[] BACKGROUNDS = {
            Color.web("#cdc1b4"),
            Color.web("#eee4da"),
            Color.web("#ede0c8"),
            Color.web("#f2b179"),
            Color.web("#f59563"),
            Color.web("#f67c5f"),
            Color.web("#f65e3b"),
            Color.web("#edcf72"),
            Color.web("#edcc61"),
            Color.web("#edc850"),
            Color.web("#edc53f"),
            Color.web("#edc22e"),
    };
    private static final Color HIGH_TILE = Color.web("#3c3a32");
    private static final Color DARK_TEXT = Color.web("#776e65");
    private static final Color LIGHT_TEXT = Color.web("#f9f6f2");

    private TilePalette() {
    }

    public static Color background(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Exponent must not be negative: " + exponent);
        }
        return exponent < BACKGROUNDS.length ? BACKGROUNDS[exponent] : HIGH_TILE;
    }

    public static Color text(int exponent) {
        return exponent <= 2 ? DARK_TEXT : LIGHT_TEXT;
    }

    /**
     * Font size that keeps longer numbers inside the tile.
     */
    public static double fontSize(int value) {
        if (value < 100) {
            return 32;
        }
        if (value < 1000) {
            return 28;
        }
        if (value < 10000) {
            return 22;
        }
        return 18;
    }
}
