package com.tilemerge.core;

import java.util.Objects;

/**
 * Successor pair produced when the game inserts a tile into one empty cell.
 *
 * @param cell     row-major index of the empty cell
 * @param withTwo  the board with a 2 in that cell
 * @param withFour the board with a 4 in that cell
 */
public record TilePlacement(int cell, BoardState withTwo, BoardState withFour) {

    public TilePlacement {
        Objects.requireNonNull(withTwo, "withTwo");
        Objects.requireNonNull(withFour, "withFour");
    }
}
