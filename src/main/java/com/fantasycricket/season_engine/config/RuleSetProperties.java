package com.fantasycricket.season_engine.config;

import com.fantasycricket.season_engine.model.PointTier;
import com.fantasycricket.season_engine.model.RuleSet;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Binds {@code fantasy.rules.*}. Defaults match {@link RuleSet#defaults()}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "fantasy.rules")
public class RuleSetProperties {

    private Batting batting = new Batting();
    private Bowling bowling = new Bowling();
    private Fielding fielding = new Fielding();
    private Leadership leadership = new Leadership();
    private Multiplier multiplier = new Multiplier();

    /** Grand-total scaling per competition tier, e.g. {@code premier: 1.2}. */
    private Map<String, Double> tierFactors = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Batting {
        private double pointsPerRun = 1.0;
        private double fiftyBonus = 8.0;
        private double centuryBonus = 16.0;
        private double duckPenalty = -2.0;
        private List<Tier> runTiers = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Bowling {
        private double pointsPerWicket = 12.0;
        private double pointsPerMaiden = 4.0;
        private double fiveWicketBonus = 8.0;
        private List<Tier> wicketTiers = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Fielding {
        private double pointsPerCatch = 4.0;
        private double pointsPerStumping = 6.0;
        private double pointsPerRunOut = 6.0;
        private double wicketkeeperCatchMultiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Leadership {
        private double captainFactor = 2.0;
        private double viceCaptainFactor = 1.5;
    }

    @Getter
    @Setter
    public static class Multiplier {
        private double min = 0.69;
        private double neutral = 1.0;
        private double max = 5.0;
        private double driftRate = 0.15;
    }

    @Getter
    @Setter
    public static class Tier {
        private int from;
        private int to;
        private double points;
    }

    public RuleSet toRuleSet() {
        Map<String, Double> factors = new LinkedHashMap<>();
        tierFactors.forEach((tier, factor) -> factors.put(tier.toLowerCase(Locale.ROOT), factor));

        return RuleSet.builder()
                .pointsPerRun(batting.pointsPerRun)
                .fiftyBonus(batting.fiftyBonus)
                .centuryBonus(batting.centuryBonus)
                .duckPenalty(batting.duckPenalty)
                .runTiers(toPointTiers(batting.runTiers))
                .pointsPerWicket(bowling.pointsPerWicket)
                .pointsPerMaiden(bowling.pointsPerMaiden)
                .fiveWicketBonus(bowling.fiveWicketBonus)
                .wicketTiers(toPointTiers(bowling.wicketTiers))
                .pointsPerCatch(fielding.pointsPerCatch)
                .pointsPerStumping(fielding.pointsPerStumping)
                .pointsPerRunOut(fielding.pointsPerRunOut)
                .wicketkeeperCatchMultiplier(fielding.wicketkeeperCatchMultiplier)
                .captainFactor(leadership.captainFactor)
                .viceCaptainFactor(leadership.viceCaptainFactor)
                .minMultiplier(multiplier.min)
                .neutralMultiplier(multiplier.neutral)
                .maxMultiplier(multiplier.max)
                .driftRate(multiplier.driftRate)
                .tierFactors(Map.copyOf(factors))
                .build()
                .validate();
    }

    private static List<PointTier> toPointTiers(List<Tier> tiers) {
        return tiers.stream()
                .map(t -> new PointTier(t.from, t.to, t.points))
                .toList();
    }
}
