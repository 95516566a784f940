package com.fantasycricket.season_engine.model;

/**
 * A band of units (runs or wickets) worth a fixed number of points each.
 * Bounds are inclusive: {@code [from, to]}.
 */
public record PointTier(int from, int to, double points) {

    public PointTier {
        if (from < 1 || to < from) {
            throw new IllegalStateException("Invalid point tier [" + from + ", " + to + "]");
        }
        if (points < 0) {
            throw new IllegalStateException("Point tier value must not be negative: " + points);
        }
    }

    /** Number of units in {@code 1..count} that fall inside this band. */
    public int unitsCovered(int count) {
        if (count < from) return 0;
        return Math.min(count, to) - from + 1;
    }
}
