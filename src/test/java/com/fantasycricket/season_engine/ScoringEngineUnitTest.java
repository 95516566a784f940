package com.fantasycricket.season_engine;

import com.fantasycricket.season_engine.model.BattingStats;
import com.fantasycricket.season_engine.model.BowlingStats;
import com.fantasycricket.season_engine.model.FieldingStats;
import com.fantasycricket.season_engine.model.LeadershipRole;
import com.fantasycricket.season_engine.model.PerformanceRecord;
import com.fantasycricket.season_engine.model.PointTier;
import com.fantasycricket.season_engine.model.RuleSet;
import com.fantasycricket.season_engine.model.ScoreBreakdown;
import com.fantasycricket.season_engine.service.ScoringEngine;
import com.fantasycricket.util.ScoreCalculator;
import com.fantasycricket.util.TestFixtures;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScoringEngine in isolation: one performance in, one breakdown out.
 */
class ScoringEngineUnitTest {

    private static final double EPS = 1e-9;

    private ScoringEngine engine;
    private RuleSet rules;

    @BeforeEach
    void setUp() {
        engine = new ScoringEngine();
        rules = RuleSet.defaults();
    }

    // =========================================================================
    // Batting
    // =========================================================================

    @Nested
    @DisplayName("Batting")
    class Batting {

        @Test
        @DisplayName("fiftyOff33_scalesByStrikeRate_andAddsFiftyBonus")
        void fiftyOff33_scalesByStrikeRate_andAddsFiftyBonus() {
            ScoreBreakdown score = engine.score(TestFixtures.batting("m1", "Jan de Vries", 50, 33, true), rules);

            assertEquals(83.75, score.battingPoints(), 0.01);
            assertEquals(ScoreCalculator.batting(50, 33, true), score.battingPoints(), EPS);
            assertEquals(50.0 / 33, score.strikeRateFactor(), EPS);
            assertEquals(8.0, score.bonusPoints(), EPS);
            assertEquals(score.battingPoints(), score.grandTotal(), EPS);
        }

        @Test
        @DisplayName("century_getsFiftyAndCenturyBonus")
        void century_getsFiftyAndCenturyBonus() {
            ScoreBreakdown score = engine.score(TestFixtures.batting("m1", "Jan de Vries", 100, 80, false), rules);

            // 100 x 1.25 + 8 + 16
            assertEquals(149.0, score.battingPoints(), EPS);
            assertEquals(24.0, score.bonusPoints(), EPS);
        }

        @Test
        @DisplayName("duck_appliesPenalty_butGrandTotalIsFlooredAtZero")
        void duck_appliesPenalty_butGrandTotalIsFlooredAtZero() {
            ScoreBreakdown score = engine.score(TestFixtures.batting("m1", "Jan de Vries", 0, 3, true), rules);

            assertEquals(-2.0, score.battingPoints(), EPS);
            assertEquals(0.0, score.grandTotal(), EPS);
        }

        @Test
        @DisplayName("noDuck_whenNotOut_orNoBallFaced")
        void noDuck_whenNotOut_orNoBallFaced() {
            assertEquals(0.0, engine.score(TestFixtures.batting("m1", "A", 0, 3, false), rules).battingPoints(), EPS);
            assertEquals(0.0, engine.score(TestFixtures.batting("m1", "A", 0, 0, true), rules).battingPoints(), EPS);
        }

        @Test
        @DisplayName("runsWithoutBalls_areNotScaled")
        void runsWithoutBalls_areNotScaled() {
            ScoreBreakdown score = engine.score(TestFixtures.batting("m1", "A", 20, 0, false), rules);

            assertEquals(20.0, score.battingPoints(), EPS);
            assertEquals(1.0, score.strikeRateFactor(), EPS);
        }

        @Test
        @DisplayName("duckPenalty_isOffsetByFieldingBeforeFloor")
        void duckPenalty_isOffsetByFieldingBeforeFloor() {
            PerformanceRecord record = TestFixtures.performance("m1", "A")
                    .batting(new BattingStats(0, 2, 0, 0, true))
                    .fielding(new FieldingStats(1, 0, 0))
                    .build();

            assertEquals(2.0, engine.score(record, rules).grandTotal(), EPS);
        }
    }

    // =========================================================================
    // Bowling
    // =========================================================================

    @Nested
    @DisplayName("Bowling")
    class Bowling {

        @Test
        @DisplayName("threeFor32OffEight_scalesByEconomy_plusMaidens")
        void threeFor32OffEight_scalesByEconomy_plusMaidens() {
            ScoreBreakdown score = engine.score(TestFixtures.bowling("m1", "A", 3, 8.0, 2, 32), rules);

            assertEquals(62.0, score.bowlingPoints(), EPS);
            assertEquals(1.5, score.economyFactor(), EPS);
            assertEquals(ScoreCalculator.bowling(3, 8.0, 2, 32), score.bowlingPoints(), EPS);
        }

        @Test
        @DisplayName("zeroEconomy_usesSixTimesScaling")
        void zeroEconomy_usesSixTimesScaling() {
            ScoreBreakdown score = engine.score(TestFixtures.bowling("m1", "A", 2, 4.0, 4, 0), rules);

            assertEquals(6.0, score.economyFactor(), EPS);
            assertEquals(2 * 12 * 6.0 + 4 * 4, score.bowlingPoints(), EPS);
        }

        @Test
        @DisplayName("economyBelowOne_isCappedAtSixTimes")
        void economyBelowOne_isCappedAtSixTimes() {
            ScoreBreakdown none = engine.score(TestFixtures.bowling("m1", "A", 3, 8.0, 0, 0), rules);
            ScoreBreakdown one = engine.score(TestFixtures.bowling("m1", "A", 3, 8.0, 0, 1), rules);

            assertEquals(6.0, one.economyFactor(), EPS);
            assertEquals(3 * 12 * 6.0, one.bowlingPoints(), EPS);
            assertEquals(none.grandTotal(), one.grandTotal(), EPS);
        }

        @Test
        @DisplayName("fiveWickets_addsHaulBonus")
        void fiveWickets_addsHaulBonus() {
            ScoreBreakdown score = engine.score(TestFixtures.bowling("m1", "A", 5, 10.0, 0, 60), rules);

            // economy 6.0 -> factor 1.0
            assertEquals(5 * 12 + 8, score.bowlingPoints(), EPS);
            assertEquals(8.0, score.bonusPoints(), EPS);
        }

        @Test
        @DisplayName("maidensWithoutWickets_areStillCounted")
        void maidensWithoutWickets_areStillCounted() {
            ScoreBreakdown score = engine.score(TestFixtures.bowling("m1", "A", 0, 6.0, 2, 20), rules);

            assertEquals(8.0, score.bowlingPoints(), EPS);
            assertEquals(1.0, score.economyFactor(), EPS);
        }
    }

    // =========================================================================
    // Fielding, tiers and totals
    // =========================================================================

    @Nested
    @DisplayName("Fielding and totals")
    class FieldingAndTotals {

        @Test
        @DisplayName("fielding_isFlatPerDismissalType")
        void fielding_isFlatPerDismissalType() {
            PerformanceRecord record = TestFixtures.performance("m1", "A")
                    .fielding(new FieldingStats(2, 1, 1))
                    .build();

            assertEquals(8 + 6 + 6, engine.score(record, rules).fieldingPoints(), EPS);
        }

        @Test
        @DisplayName("wicketkeeperCatches_areWeighted")
        void wicketkeeperCatches_areWeighted() {
            PerformanceRecord record = TestFixtures.performance("m1", "A")
                    .wicketkeeper(true)
                    .fielding(new FieldingStats(2, 1, 0))
                    .build();

            assertEquals(2 * 4 * 2.0 + 6, engine.score(record, rules).fieldingPoints(), EPS);
        }

        @Test
        @DisplayName("emptyRecord_scoresZero")
        void emptyRecord_scoresZero() {
            ScoreBreakdown score = engine.score(TestFixtures.performance("m1", "A").build(), rules);

            assertEquals(0.0, score.grandTotal(), EPS);
            assertEquals(1.0, score.tierFactor(), EPS);
        }

        @Test
        @DisplayName("tierFactor_scalesFlooredTotal_caseInsensitive")
        void tierFactor_scalesFlooredTotal_caseInsensitive() {
            RuleSet scaled = rules.toBuilder().tierFactors(Map.of("topklasse", 1.5)).build();
            PerformanceRecord record = TestFixtures.performance("m1", "A")
                    .tier("Topklasse")
                    .batting(new BattingStats(20, 0, 0, 0, false))
                    .build();

            ScoreBreakdown score = engine.score(record, scaled);

            assertEquals(1.5, score.tierFactor(), EPS);
            assertEquals(30.0, score.grandTotal(), EPS);
        }

        @Test
        @DisplayName("runTiers_replaceFlatRate_perBand")
        void runTiers_replaceFlatRate_perBand() {
            RuleSet tiered = rules.toBuilder()
                    .runTiers(List.of(
                            new PointTier(1, 30, 1.0),
                            new PointTier(31, 49, 1.25),
                            new PointTier(50, 99, 1.5),
                            new PointTier(100, 999, 1.75)))
                    .build()
                    .validate();

            ScoreBreakdown score = engine.score(TestFixtures.batting("m1", "A", 60, 0, false), tiered);

            // 30 x 1.0 + 19 x 1.25 + 11 x 1.5 + fifty bonus
            assertEquals(30 + 23.75 + 16.5 + 8, score.battingPoints(), EPS);
        }

        @Test
        @DisplayName("wicketTiers_replaceFlatRate_perBand")
        void wicketTiers_replaceFlatRate_perBand() {
            RuleSet tiered = rules.toBuilder()
                    .wicketTiers(List.of(
                            new PointTier(1, 2, 15),
                            new PointTier(3, 4, 20),
                            new PointTier(5, 10, 30)))
                    .build()
                    .validate();

            // 12 runs off 2 overs: economy 6.0, factor 1.0
            ScoreBreakdown score = engine.score(TestFixtures.bowling("m1", "A", 3, 2.0, 0, 12), tiered);

            assertEquals(15 + 15 + 20, score.bowlingPoints(), EPS);
        }
    }

    // =========================================================================
    // Monotonicity
    // =========================================================================

    @Nested
    @DisplayName("Monotonicity")
    class Monotonicity {

        @Test
        @DisplayName("moreRuns_atFixedBalls_neverScoresLess")
        void moreRuns_atFixedBalls_neverScoresLess() {
            double previous = -1;
            for (int runs = 0; runs <= 160; runs++) {
                double total = engine.score(TestFixtures.batting("m1", "A", runs, 60, true), rules).grandTotal();
                assertTrue(total >= previous, "runs=" + runs);
                previous = total;
            }
        }

        @Test
        @DisplayName("moreWickets_atFixedEconomy_neverScoresLess")
        void moreWickets_atFixedEconomy_neverScoresLess() {
            double previous = -1;
            for (int wickets = 0; wickets <= 10; wickets++) {
                double total = engine.score(TestFixtures.bowling("m1", "A", wickets, 8.0, 0, 40), rules).grandTotal();
                assertTrue(total >= previous, "wickets=" + wickets);
                previous = total;
            }
        }

        @Test
        @DisplayName("worseEconomy_neverScoresMore")
        void worseEconomy_neverScoresMore() {
            double previous = Double.MAX_VALUE;
            for (int conceded = 0; conceded <= 80; conceded++) {
                double total = engine.score(TestFixtures.bowling("m1", "A", 3, 8.0, 1, conceded), rules).grandTotal();
                assertTrue(total <= previous, "conceded=" + conceded);
                previous = total;
            }
        }

        @Test
        @DisplayName("productionMatchesMirror_acrossMixedPerformances")
        void productionMatchesMirror_acrossMixedPerformances() {
            int[][] cases = {{0, 1, 0, 0}, {17, 22, 1, 4}, {64, 41, 2, 30}, {112, 90, 5, 18}, {3, 9, 0, 55}};
            for (int[] c : cases) {
                PerformanceRecord record = TestFixtures.performance("m1", "A")
                        .batting(new BattingStats(c[0], c[1], 0, 0, true))
                        .bowling(new BowlingStats(c[2], 7.0, 0, c[3]))
                        .build();
                double expected = ScoreCalculator.total(
                        ScoreCalculator.batting(c[0], c[1], true),
                        ScoreCalculator.bowling(c[2], 7.0, 0, c[3]),
                        0);

                assertEquals(expected, engine.score(record, rules).grandTotal(), EPS);
            }
        }
    }

    // =========================================================================
    // Downstream helpers
    // =========================================================================

    @Nested
    @DisplayName("Multiplier and leadership")
    class Helpers {

        @Test
        @DisplayName("captain_doublesHandicappedPoints")
        void captain_doublesHandicappedPoints() {
            assertEquals(90.0, engine.effectivePoints(50, 0.9, LeadershipRole.CAPTAIN, rules), 1e-6);
        }

        @Test
        @DisplayName("viceCaptain_isOnePointFiveTimes")
        void viceCaptain_isOnePointFiveTimes() {
            assertEquals(60.0, engine.effectivePoints(40, 1.0, LeadershipRole.VICE_CAPTAIN, rules), 1e-6);
        }

        @Test
        @DisplayName("noRole_isHandicapOnly")
        void noRole_isHandicapOnly() {
            assertEquals(80.0, engine.effectivePoints(40, 2.0, LeadershipRole.NONE, rules), 1e-6);
            assertEquals(engine.applyMultiplier(40, 2.0), engine.effectivePoints(40, 2.0, LeadershipRole.NONE, rules), 1e-9);
        }
    }
}
