package com.tilemerge.core.ai;

import com.tilemerge.core.Direction;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param direction the selected move
 * @param score     the expected score of the selected move
 * @param terminal  {@code true} when no direction changes the board
 * @param telemetry per-direction instrumentation
 */
public record SearchResult(Direction direction, double score, boolean terminal, SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(direction, "direction");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    /**
     * Picks the highest scoring legal direction. Reports are visited in enumeration order and a
     * later direction must score strictly higher to replace an earlier one. When every direction is
     * a no-op the result is {@link Direction#UP} with score 0 and the terminal flag set.
     */
    public static SearchResult select(SearchTelemetry telemetry) {
        Objects.requireNonNull(telemetry, "telemetry");
        Direction best = null;
        double bestScore = 0.0;
        for (Direction direction : Direction.values()) {
            SearchTelemetry.DirectionReport report = telemetry.report(direction);
            if (report == null || report.noOp()) {
                continue;
            }
            if (best == null || report.score() > bestScore) {
                best = direction;
                bestScore = report.score();
            }
        }
        if (best == null) {
            return new SearchResult(Direction.UP, 0.0, true, telemetry);
        }
        return new SearchResult(best, bestScore, false, telemetry);
    }
}
