package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.CanonicalPlayer;
import com.fantasycricket.season_engine.model.HistoryEntry;
import com.fantasycricket.season_engine.model.LeagueRoster;
import com.fantasycricket.season_engine.model.MultiplierAdjustment;
import com.fantasycricket.season_engine.model.MultiplierScope;
import com.fantasycricket.season_engine.model.MultiplierSnapshot;
import com.fantasycricket.season_engine.model.RuleSet;
import com.fantasycricket.season_engine.model.ScoreDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs handicap passes against a season.
 *
 * Flow:
 * 1. Pause ingestion for the season.
 * 2. Snapshot season points (global) or rescore league points from history.
 * 3. Compute the new snapshot with {@link HandicapEngine}.
 * 4. Unless dry-run: save the snapshot, and for the global scope write each
 *    player's new multiplier back. League passes never touch player records.
 */
@Service
public class HandicapService {

    private static final Logger log = LoggerFactory.getLogger(HandicapService.class);
    private static final int LOGGED_CHANGES = 10;

    private final HandicapEngine handicapEngine;
    private final ScoringEngine scoringEngine;

    public HandicapService(HandicapEngine handicapEngine, ScoringEngine scoringEngine) {
        this.handicapEngine = handicapEngine;
        this.scoringEngine = scoringEngine;
    }

    // =========================================================================
    // Global scope
    // =========================================================================

    public MultiplierSnapshot recomputeGlobal(SeasonAggregator season, boolean dryRun) {
        return season.withIngestionPaused(() -> {
            Map<String, Double> points = season.snapshotSeasonPoints();
            Map<String, Double> previous = new LinkedHashMap<>();
            for (CanonicalPlayer player : season.getPlayerRepository().findAll()) {
                previous.put(player.getKey(), player.getMultiplier());
            }

            MultiplierSnapshot snapshot = handicapEngine.adjust(
                    MultiplierScope.GLOBAL, points, previous, season.getRuleSet());
            logPass(season, snapshot, dryRun);
            if (dryRun) {
                return snapshot;
            }

            snapshot.multipliers().forEach((key, multiplier) ->
                    season.getPlayer(key).ifPresent(p -> p.updateMultiplier(multiplier)));
            season.getSnapshotRepository().save(snapshot);
            return snapshot;
        });
    }

    // =========================================================================
    // League scope
    // =========================================================================

    /**
     * League pass: points are rescored from each player's history under the
     * league's rule set (or the season's when the roster has none). A player
     * without a previous league multiplier starts from their global one.
     */
    public MultiplierSnapshot recomputeLeague(SeasonAggregator season, LeagueRoster roster, boolean dryRun) {
        RuleSet rules = roster.rules() != null ? roster.rules() : season.getRuleSet();
        MultiplierScope scope = roster.scope();

        return season.withIngestionPaused(() -> {
            Optional<MultiplierSnapshot> last = season.getSnapshotRepository().findByScope(scope);
            Map<String, Double> points = new LinkedHashMap<>();
            Map<String, Double> previous = new LinkedHashMap<>();

            for (String key : roster.playerKeys()) {
                Optional<CanonicalPlayer> player = season.getPlayer(key);
                if (player.isEmpty()) {
                    log.warn("League {} lists unknown player {}, skipping", roster.leagueId(), key);
                    continue;
                }
                points.put(key, leaguePoints(player.get(), rules));
                double start = last.flatMap(s -> s.multiplierFor(key))
                        .orElse(player.get().getMultiplier());
                previous.put(key, start);
            }

            MultiplierSnapshot snapshot = handicapEngine.adjust(scope, points, previous, rules);
            logPass(season, snapshot, dryRun);
            if (!dryRun) {
                season.getSnapshotRepository().save(snapshot);
            }
            return snapshot;
        });
    }

    private double leaguePoints(CanonicalPlayer player, RuleSet rules) {
        double total = 0;
        for (HistoryEntry entry : player.getHistory()) {
            total += scoringEngine.score(entry.performance(), rules).grandTotal();
        }
        return total;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void logPass(SeasonAggregator season, MultiplierSnapshot snapshot, boolean dryRun) {
        ScoreDistribution d = snapshot.distribution();
        log.info("Handicap pass {} for {} {}: {} players, scores min={} median={} mean={} max={}",
                dryRun ? "(dry run)" : "committed", season.getScope(), snapshot.scope(),
                snapshot.multipliers().size(),
                format(d.min()), format(d.median()), format(d.mean()), format(d.max()));
        if (log.isDebugEnabled()) {
            for (MultiplierAdjustment a : snapshot.largestChanges(LOGGED_CHANGES)) {
                log.debug("  {}: {} -> {} (target {}, score {})",
                        a.playerKey(), a.previousMultiplier(), a.newMultiplier(),
                        a.targetMultiplier(), format(a.seasonPoints()));
            }
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
