package com.fantasycricket.season_engine.model;

/**
 * Ratios derived from {@link SeasonTotals}; never stored independently.
 *
 * Batting average divides by an estimate of dismissals,
 * {@code max(1, innings - innings / 5)}, roughly one not-out in five, even
 * when some dismissals are recorded.
 */
public record SeasonAverages(
        double battingAverage,
        double strikeRate,
        double bowlingAverage,
        double economy,
        double pointsPerMatch
) {

    public static SeasonAverages from(SeasonTotals totals) {
        double battingAverage = 0;
        if (totals.getBattingInnings() > 0) {
            battingAverage = round2((double) totals.getRuns() / estimatedDismissals(totals));
        }
        double strikeRate = totals.getBallsFaced() > 0
                ? round2((double) totals.getRuns() / totals.getBallsFaced() * 100)
                : 0;
        double bowlingAverage = totals.getWickets() > 0
                ? round2((double) totals.getRunsConceded() / totals.getWickets())
                : 0;
        double economy = totals.getOvers() > 0
                ? round2(totals.getRunsConceded() / totals.getOvers())
                : 0;
        double pointsPerMatch = totals.getMatches() > 0
                ? round2(totals.getFantasyPoints() / totals.getMatches())
                : 0;
        return new SeasonAverages(battingAverage, strikeRate, bowlingAverage, economy, pointsPerMatch);
    }

    private static int estimatedDismissals(SeasonTotals totals) {
        int innings = totals.getBattingInnings();
        return Math.max(1, innings - innings / 5);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
