package com.fantasycricket.season_engine.model;

public record FieldingStats(int catches, int stumpings, int runOuts) {

    public static final FieldingStats EMPTY = new FieldingStats(0, 0, 0);
}
