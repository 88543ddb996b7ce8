package com.tilemerge.core.ai;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe memo of chance node scores keyed by packed board.
 * Sibling branches may race on the same board; the last write wins.
 */
public final class TranspositionTable {

    private final ConcurrentHashMap<Long, TTEntry> entries = new ConcurrentHashMap<>();

    public TTEntry get(long board) {
        return entries.get(board);
    }

    public void put(long board, TTEntry entry) {
        entries.put(board, Objects.requireNonNull(entry, "entry"));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
