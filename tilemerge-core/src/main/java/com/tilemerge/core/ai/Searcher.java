package com.tilemerge.core.ai;

import com.tilemerge.core.BoardState;

/**
 * Generic interface for move search implementations.
 */
public interface Searcher {

    /**
     * Scores the four directions on the provided board and selects the best one.
     *
     * @param state the board to analyse
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     */
    SearchResult search(BoardState state, SearchConstraints constraints);
}
