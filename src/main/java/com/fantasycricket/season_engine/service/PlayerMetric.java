package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.CanonicalPlayer;

import java.util.function.ToDoubleFunction;

/**
 * Sort keys for season leaderboards.
 */
public enum PlayerMetric {

    FANTASY_POINTS(CanonicalPlayer::getSeasonPoints),
    RUNS(p -> p.getTotals().getRuns()),
    WICKETS(p -> p.getTotals().getWickets()),
    BATTING_AVERAGE(p -> p.getAverages().battingAverage()),
    STRIKE_RATE(p -> p.getAverages().strikeRate()),
    MATCHES(CanonicalPlayer::getMatchesPlayed);

    private final ToDoubleFunction<CanonicalPlayer> extractor;

    PlayerMetric(ToDoubleFunction<CanonicalPlayer> extractor) {
        this.extractor = extractor;
    }

    public double extract(CanonicalPlayer player) {
        return extractor.applyAsDouble(player);
    }
}
