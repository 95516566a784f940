package com.fantasycricket.season_engine.model;

/**
 * Best bowling figures: most wickets, then fewest runs conceded.
 */
public record BowlingFigures(int wickets, int runsConceded) {

    public boolean isBetterThan(BowlingFigures other) {
        if (other == null) return true;
        if (wickets != other.wickets) return wickets > other.wickets;
        return runsConceded < other.runsConceded;
    }

    @Override
    public String toString() {
        return wickets + "/" + runsConceded;
    }
}
