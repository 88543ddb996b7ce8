package com.tilemerge.core.ai;

/**
 * Entry stored inside the transposition table.
 *
 * @param score the expected score of the chance node
 * @param depth the chance depth at which the score was computed
 */
public record TTEntry(double score, int depth) {
}
