package com.fantasycricket.season_engine.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable scoring and handicap constants. Built once from configuration
 * (or per league) and shared read-only by every computation pass.
 *
 * Defaults are the standard club rules: 1 per run, 12 per wicket, fifty +8,
 * century +16, duck -2, multiplier bounds [0.69, 5.0] around 1.0, drift 0.15.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class RuleSet {

    // Batting
    @Builder.Default private final double pointsPerRun = 1.0;
    @Builder.Default private final List<PointTier> runTiers = List.of();
    @Builder.Default private final double fiftyBonus = 8.0;
    @Builder.Default private final double centuryBonus = 16.0;
    @Builder.Default private final double duckPenalty = -2.0;

    // Bowling
    @Builder.Default private final double pointsPerWicket = 12.0;
    @Builder.Default private final List<PointTier> wicketTiers = List.of();
    @Builder.Default private final double pointsPerMaiden = 4.0;
    @Builder.Default private final double fiveWicketBonus = 8.0;

    // Fielding
    @Builder.Default private final double pointsPerCatch = 4.0;
    @Builder.Default private final double pointsPerStumping = 6.0;
    @Builder.Default private final double pointsPerRunOut = 6.0;
    @Builder.Default private final double wicketkeeperCatchMultiplier = 2.0;

    // Per-grade scaling of the grand total, keyed by lower-cased tier name
    @Builder.Default private final Map<String, Double> tierFactors = Map.of();

    // Leadership
    @Builder.Default private final double captainFactor = 2.0;
    @Builder.Default private final double viceCaptainFactor = 1.5;

    // Handicap
    @Builder.Default private final double minMultiplier = 0.69;
    @Builder.Default private final double neutralMultiplier = 1.0;
    @Builder.Default private final double maxMultiplier = 5.0;
    @Builder.Default private final double driftRate = 0.15;

    public static RuleSet defaults() {
        return RuleSet.builder().build();
    }

    public boolean hasRunTiers() {
        return runTiers != null && !runTiers.isEmpty();
    }

    public boolean hasWicketTiers() {
        return wicketTiers != null && !wicketTiers.isEmpty();
    }

    public double tierFactor(String tier) {
        if (tier == null || tierFactors == null) return 1.0;
        return tierFactors.getOrDefault(tier.toLowerCase(Locale.ROOT), 1.0);
    }

    public double leadershipFactor(LeadershipRole role) {
        return switch (role) {
            case CAPTAIN -> captainFactor;
            case VICE_CAPTAIN -> viceCaptainFactor;
            case NONE -> 1.0;
        };
    }

    /**
     * Reject inconsistent constants. Returns {@code this} so it can be chained
     * onto {@code build()}.
     *
     * @throws IllegalStateException describing the first violated constraint
     */
    public RuleSet validate() {
        if (minMultiplier <= 0) {
            throw new IllegalStateException("minMultiplier must be positive, was " + minMultiplier);
        }
        if (minMultiplier > neutralMultiplier || neutralMultiplier > maxMultiplier) {
            throw new IllegalStateException("Multiplier bounds must satisfy min <= neutral <= max, was "
                    + minMultiplier + " / " + neutralMultiplier + " / " + maxMultiplier);
        }
        if (driftRate <= 0 || driftRate > 1) {
            throw new IllegalStateException("driftRate must be in (0, 1], was " + driftRate);
        }
        requireNonNegative("pointsPerRun", pointsPerRun);
        requireNonNegative("fiftyBonus", fiftyBonus);
        requireNonNegative("centuryBonus", centuryBonus);
        requireNonNegative("pointsPerWicket", pointsPerWicket);
        requireNonNegative("pointsPerMaiden", pointsPerMaiden);
        requireNonNegative("fiveWicketBonus", fiveWicketBonus);
        requireNonNegative("pointsPerCatch", pointsPerCatch);
        requireNonNegative("pointsPerStumping", pointsPerStumping);
        requireNonNegative("pointsPerRunOut", pointsPerRunOut);
        requireNonNegative("wicketkeeperCatchMultiplier", wicketkeeperCatchMultiplier);
        if (duckPenalty > 0) {
            throw new IllegalStateException("duckPenalty must be zero or negative, was " + duckPenalty);
        }
        requireDisjoint("runTiers", runTiers);
        requireDisjoint("wicketTiers", wicketTiers);
        if (tierFactors != null) {
            tierFactors.forEach((tier, factor) -> requireNonNegative("tierFactors." + tier, factor));
        }
        return this;
    }

    private static void requireDisjoint(String name, List<PointTier> tiers) {
        if (tiers == null) return;
        for (int i = 1; i < tiers.size(); i++) {
            if (tiers.get(i).from() <= tiers.get(i - 1).to()) {
                throw new IllegalStateException(name + " must be ascending and non-overlapping, was " + tiers);
            }
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0) {
            throw new IllegalStateException(name + " must not be negative, was " + value);
        }
    }
}
