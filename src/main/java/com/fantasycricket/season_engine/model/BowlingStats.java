package com.fantasycricket.season_engine.model;

/**
 * One bowling spell. Overs are kept in scorecard notation (4.3 = four overs
 * and three balls) and summed as plain decimals.
 */
public record BowlingStats(int wickets, double overs, int maidens, int runsConceded) {

    public static final BowlingStats EMPTY = new BowlingStats(0, 0.0, 0, 0);
}
