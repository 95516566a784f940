package com.fantasycricket.season_engine.model;

import java.util.Objects;

/**
 * Identifies one season. All player state is partitioned by this scope.
 */
public record SeasonScope(String competition, int year) {

    public SeasonScope {
        Objects.requireNonNull(competition, "competition");
    }

    @Override
    public String toString() {
        return competition + "/" + year;
    }
}
