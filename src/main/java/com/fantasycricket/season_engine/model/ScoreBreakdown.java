package com.fantasycricket.season_engine.model;

/**
 * Fantasy points for one performance, split by discipline.
 *
 * {@code bonusPoints} is informational: milestone bonuses and the duck
 * penalty are already included in {@code battingPoints} / {@code bowlingPoints}.
 * The scaling factors are carried for auditing.
 */
public record ScoreBreakdown(
        double battingPoints,
        double bowlingPoints,
        double fieldingPoints,
        double bonusPoints,
        double strikeRateFactor,
        double economyFactor,
        double tierFactor,
        double grandTotal
) {

    public static final ScoreBreakdown ZERO = new ScoreBreakdown(0, 0, 0, 0, 1.0, 1.0, 1.0, 0);
}
