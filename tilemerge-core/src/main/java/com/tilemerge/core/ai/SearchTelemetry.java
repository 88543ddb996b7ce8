package com.tilemerge.core.ai;

import com.tilemerge.core.Direction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated instrumentation data captured during a single {@link Searcher#search} call, one
 * report per top-level direction in enumeration order.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(List.of(), 0L);

    private final List<DirectionReport> directions;
    private final long elapsedNanos;

    public SearchTelemetry(List<DirectionReport> directions, long elapsedNanos) {
        if (directions == null || directions.isEmpty()) {
            this.directions = List.of();
        } else {
            this.directions = Collections.unmodifiableList(new ArrayList<>(directions));
        }
        this.elapsedNanos = Math.max(0L, elapsedNanos);
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public List<DirectionReport> directions() {
        return directions;
    }

    public DirectionReport report(Direction direction) {
        Objects.requireNonNull(direction, "direction");
        for (DirectionReport report : directions) {
            if (report.direction() == direction) {
                return report;
            }
        }
        return null;
    }

    public long elapsedNanos() {
        return elapsedNanos;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    public long totalMovesEvaluated() {
        return directions.stream().mapToLong(DirectionReport::movesEvaluated).sum();
    }

    public long totalCacheHits() {
        return directions.stream().mapToLong(DirectionReport::cacheHits).sum();
    }

    public long totalCacheStores() {
        return directions.stream().mapToLong(DirectionReport::cacheStores).sum();
    }

    public int maxDepth() {
        return directions.stream().mapToInt(DirectionReport::maxDepth).max().orElse(0);
    }

    public record DirectionReport(
            Direction direction,
            double score,
            boolean noOp,
            int depthLimit,
            long movesEvaluated,
            long cacheHits,
            long cacheStores,
            int cacheSize,
            int maxDepth,
            long elapsedNanos) {

        public DirectionReport {
            Objects.requireNonNull(direction, "direction");
        }

        /**
         * Report for a direction that leaves the board unchanged.
         */
        public static DirectionReport noOp(Direction direction) {
            return new DirectionReport(direction, 0.0, true, 0, 0L, 0L, 0L, 0, 0, 0L);
        }

        public double elapsedMillis() {
            return elapsedNanos / 1_000_000.0;
        }
    }
}
