package com.tilemerge.core;

/**
 * Tunables of the per-row heuristic.
 *
 * @param lostPenalty        constant baseline added to every row
 * @param emptyWeight        reward per empty cell
 * @param mergesWeight       reward per tile that can merge with a neighbour
 * @param monotonicityPower  exponent applied to tile ranks before measuring monotonicity
 * @param monotonicityWeight penalty per unit of non-monotonicity
 * @param sumPower           exponent applied to tile ranks before summing them
 * @param sumWeight          penalty per unit of the ranked tile sum
 */
public record HeuristicWeights(
        double lostPenalty,
        double emptyWeight,
        double mergesWeight,
        double monotonicityPower,
        double monotonicityWeight,
        double sumPower,
        double sumWeight) {

    public static final HeuristicWeights DEFAULT = new HeuristicWeights(200000.0, 270.0, 700.0, 4.0, 47.0, 3.5, 11.0);

    public HeuristicWeights {
        requireFinite(lostPenalty, "lostPenalty");
        requireNonNegative(emptyWeight, "emptyWeight");
        requireNonNegative(mergesWeight, "mergesWeight");
        requireNonNegative(monotonicityPower, "monotonicityPower");
        requireNonNegative(monotonicityWeight, "monotonicityWeight");
        requireNonNegative(sumPower, "sumPower");
        requireNonNegative(sumWeight, "sumWeight");
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite: " + value);
        }
    }

    private static void requireNonNegative(double value, String name) {
        requireFinite(value, name);
        if (value < 0.0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
