package com.fantasycricket.season_engine.model;

/**
 * Summary of the non-zero season scores in a scope.
 */
public record ScoreDistribution(int count, double min, double median, double mean, double max) {

    public static final ScoreDistribution EMPTY = new ScoreDistribution(0, 0, 0, 0, 0);

    public boolean isEmpty() {
        return count == 0;
    }
}
