package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.RuleSet;
import com.fantasycricket.season_engine.model.ScoreDistribution;

import java.util.Arrays;
import java.util.Collection;

/**
 * Pure handicap math. Stateless, no dependencies.
 *
 * Target multiplier for season score s, over the non-zero scores of a scope:
 *   s == 0:           neutral
 *   s <= median:      max - ((s - min) / (median - min)) * (max - neutral)
 *   s >  median:      neutral - ((s - median) / (max - median)) * (neutral - min)
 *   (median == min or median == max collapses that half to neutral)
 *
 * Blended multiplier:
 *   new = round2(previous * (1 - drift) + target * drift), clamped to [min, max]
 *
 * If rounding would leave the multiplier unchanged while it is still away from
 * the target, it moves one hundredth toward the target instead, provided that
 * strictly narrows the gap. Repeated passes therefore settle on the target.
 */
public class HandicapCalculator {

    private static final double STEP = 0.01;

    // =========================================================================
    // Distribution
    // =========================================================================

    /**
     * Min, median, mean and max over the non-zero scores. Even counts use
     * the mean of the two middle values.
     */
    public static ScoreDistribution distribution(Collection<Double> scores) {
        double[] nonZero = scores.stream()
                .mapToDouble(Double::doubleValue)
                .filter(s -> s != 0)
                .sorted()
                .toArray();
        if (nonZero.length == 0) {
            return ScoreDistribution.EMPTY;
        }
        int n = nonZero.length;
        double median = n % 2 == 1
                ? nonZero[n / 2]
                : (nonZero[n / 2 - 1] + nonZero[n / 2]) / 2.0;
        double mean = Arrays.stream(nonZero).sum() / n;
        return new ScoreDistribution(n, nonZero[0], median, mean, nonZero[n - 1]);
    }

    // =========================================================================
    // Target
    // =========================================================================

    public static double targetMultiplier(double score, ScoreDistribution distribution, RuleSet rules) {
        double neutral = rules.getNeutralMultiplier();
        if (score == 0 || distribution.isEmpty()) {
            return neutral;
        }
        double min = distribution.min();
        double median = distribution.median();
        double max = distribution.max();

        double target;
        if (score <= median) {
            if (median == min) return neutral;
            double ratio = (score - min) / (median - min);
            target = rules.getMaxMultiplier() - ratio * (rules.getMaxMultiplier() - neutral);
        } else {
            if (median == max) return neutral;
            double ratio = (score - median) / (max - median);
            target = neutral - ratio * (neutral - rules.getMinMultiplier());
        }
        return clamp(target, rules.getMinMultiplier(), rules.getMaxMultiplier());
    }

    // =========================================================================
    // Drift
    // =========================================================================

    public static double blend(double previous, double target, RuleSet rules) {
        double drift = rules.getDriftRate();
        double blended = round2(previous * (1 - drift) + target * drift);

        if (blended == previous && previous != target) {
            double stepped = round2(previous + Math.signum(target - previous) * STEP);
            if (Math.abs(stepped - target) < Math.abs(previous - target)) {
                blended = stepped;
            }
        }
        return clamp(blended, rules.getMinMultiplier(), rules.getMaxMultiplier());
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
