package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.BattingStats;
import com.fantasycricket.season_engine.model.BowlingStats;
import com.fantasycricket.season_engine.model.FieldingStats;
import com.fantasycricket.season_engine.model.LeadershipRole;
import com.fantasycricket.season_engine.model.PerformanceRecord;
import com.fantasycricket.season_engine.model.PointTier;
import com.fantasycricket.season_engine.model.RuleSet;
import com.fantasycricket.season_engine.model.ScoreBreakdown;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fantasy points for a single performance. Stateless and side-effect free.
 *
 * Batting:
 *   base      = runs x pointsPerRun (or the sum over run tiers)
 *   batting   = base x (strikeRate / 100)      when balls > 0 and runs > 0
 *             + fiftyBonus                     when runs >= 50
 *             + centuryBonus                   when runs >= 100
 *             + duckPenalty                    when out for 0 off >= 1 ball
 *
 * Bowling:
 *   base      = wickets x pointsPerWicket (or the sum over wicket tiers)
 *   bowling   = base x min(6.0, 6.0 / economy) when overs > 0 and wickets > 0
 *                                              (economy 0 scales by 6.0)
 *             + maidens x pointsPerMaiden
 *             + fiveWicketBonus                when wickets >= 5
 *
 * Fielding: flat per catch, stumping and run-out. Keeper catches are
 * weighted by wicketkeeperCatchMultiplier.
 *
 * Grand total = max(0, batting + bowling + fielding) x tierFactor.
 * Components themselves may be negative.
 */
@Service
public class ScoringEngine {

    private static final double ECONOMY_BASELINE = 6.0;

    public ScoreBreakdown score(PerformanceRecord record, RuleSet rules) {
        BattingStats batting = record.battingOrEmpty();
        BowlingStats bowling = record.bowlingOrEmpty();
        FieldingStats fielding = record.fieldingOrEmpty();

        // Batting
        double strikeRateFactor = strikeRateFactor(batting);
        double battingBase = unitPoints(batting.runs(), rules.getRunTiers(), rules.getPointsPerRun());
        double battingBonus = battingBonus(batting, rules);
        double battingPoints = battingBase * strikeRateFactor + battingBonus;

        // Bowling
        double economyFactor = economyFactor(bowling);
        double bowlingBase = unitPoints(bowling.wickets(), rules.getWicketTiers(), rules.getPointsPerWicket());
        double bowlingBonus = bowling.wickets() >= 5 ? rules.getFiveWicketBonus() : 0;
        double bowlingPoints = bowlingBase * economyFactor
                + bowling.maidens() * rules.getPointsPerMaiden()
                + bowlingBonus;

        double fieldingPoints = fieldingPoints(fielding, record.wicketkeeper(), rules);

        double tierFactor = rules.tierFactor(record.tier());
        double grandTotal = Math.max(0.0, battingPoints + bowlingPoints + fieldingPoints) * tierFactor;

        return new ScoreBreakdown(
                battingPoints, bowlingPoints, fieldingPoints,
                battingBonus + bowlingBonus,
                strikeRateFactor, economyFactor, tierFactor,
                grandTotal);
    }

    // =========================================================================
    // Downstream helpers
    // =========================================================================

    /** Points after the player's handicap. */
    public double applyMultiplier(double basePoints, double multiplier) {
        return basePoints * multiplier;
    }

    /** Points after handicap and the team's captaincy choice. */
    public double effectivePoints(double basePoints, double multiplier, LeadershipRole role, RuleSet rules) {
        return applyMultiplier(basePoints, multiplier) * rules.leadershipFactor(role);
    }

    // =========================================================================
    // Components
    // =========================================================================

    static double strikeRateFactor(BattingStats batting) {
        if (batting.ballsFaced() <= 0 || batting.runs() <= 0) return 1.0;
        double strikeRate = (double) batting.runs() / batting.ballsFaced() * 100;
        return strikeRate / 100;
    }

    static double economyFactor(BowlingStats bowling) {
        if (bowling.overs() <= 0 || bowling.wickets() <= 0) return 1.0;
        double economy = bowling.runsConceded() / bowling.overs();
        if (economy == 0) return ECONOMY_BASELINE;
        return Math.min(ECONOMY_BASELINE, ECONOMY_BASELINE / economy);
    }

    private static double battingBonus(BattingStats batting, RuleSet rules) {
        double bonus = 0;
        if (batting.runs() >= 50) bonus += rules.getFiftyBonus();
        if (batting.runs() >= 100) bonus += rules.getCenturyBonus();
        if (batting.isDuck()) bonus += rules.getDuckPenalty();
        return bonus;
    }

    private static double fieldingPoints(FieldingStats fielding, boolean wicketkeeper, RuleSet rules) {
        double catchValue = rules.getPointsPerCatch();
        if (wicketkeeper) {
            catchValue *= rules.getWicketkeeperCatchMultiplier();
        }
        return fielding.catches() * catchValue
                + fielding.stumpings() * rules.getPointsPerStumping()
                + fielding.runOuts() * rules.getPointsPerRunOut();
    }

    /**
     * Points for {@code count} runs or wickets. With tiers, each unit scores
     * at the rate of the band it falls in; units outside every band score the
     * flat rate.
     */
    static double unitPoints(int count, List<PointTier> tiers, double flatRate) {
        if (count <= 0) return 0;
        if (tiers == null || tiers.isEmpty()) return count * flatRate;

        double points = 0;
        int covered = 0;
        for (PointTier tier : tiers) {
            int units = tier.unitsCovered(count);
            points += units * tier.points();
            covered += units;
        }
        return points + (count - covered) * flatRate;
    }
}
