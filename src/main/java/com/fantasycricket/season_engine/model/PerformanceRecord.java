package com.fantasycricket.season_engine.model;

import lombok.Builder;

import java.time.LocalDate;

/**
 * A single player's contribution to one match, as delivered by the scraper.
 *
 * Every section is optional: a player who did not bat has a null
 * {@code batting}, and so on. Use the {@code *OrEmpty()} accessors when a
 * zero-valued section is more convenient than a null check.
 *
 * {@code playerId} is the federation's stable identifier when the scorecard
 * exposes one; many club scorecards only carry a display name.
 */
@Builder
public record PerformanceRecord(
        String matchId,
        String playerId,
        String playerName,
        String club,
        String tier,
        LocalDate matchDate,
        String opponent,
        boolean wicketkeeper,
        BattingStats batting,
        BowlingStats bowling,
        FieldingStats fielding
) {

    public boolean hasStableId() {
        return playerId != null && !playerId.isBlank();
    }

    public boolean hasPlayerName() {
        return playerName != null && !playerName.isBlank();
    }

    public BattingStats battingOrEmpty() {
        return batting != null ? batting : BattingStats.EMPTY;
    }

    public BowlingStats bowlingOrEmpty() {
        return bowling != null ? bowling : BowlingStats.EMPTY;
    }

    public FieldingStats fieldingOrEmpty() {
        return fielding != null ? fielding : FieldingStats.EMPTY;
    }
}
