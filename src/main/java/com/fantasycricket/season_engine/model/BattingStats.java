package com.fantasycricket.season_engine.model;

/**
 * One batting innings as scraped from a scorecard.
 */
public record BattingStats(int runs, int ballsFaced, int fours, int sixes, boolean dismissed) {

    public static final BattingStats EMPTY = new BattingStats(0, 0, 0, 0, false);

    public boolean isDuck() {
        return dismissed && runs == 0 && ballsFaced > 0;
    }
}
