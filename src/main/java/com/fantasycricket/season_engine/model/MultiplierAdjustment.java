package com.fantasycricket.season_engine.model;

public record MultiplierAdjustment(
        String playerKey,
        double seasonPoints,
        double previousMultiplier,
        double targetMultiplier,
        double newMultiplier
) {

    public double change() {
        return newMultiplier - previousMultiplier;
    }
}
