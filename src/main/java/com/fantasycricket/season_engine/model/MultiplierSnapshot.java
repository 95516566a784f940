package com.fantasycricket.season_engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The result of one handicap pass over a scope. Immutable; a new pass
 * replaces the previous snapshot for the same scope wholesale.
 */
public record MultiplierSnapshot(
        MultiplierScope scope,
        Map<String, Double> multipliers,
        List<MultiplierAdjustment> adjustments,
        ScoreDistribution distribution,
        Instant computedAt
) {

    public MultiplierSnapshot {
        multipliers = Collections.unmodifiableMap(new LinkedHashMap<>(multipliers));
        adjustments = List.copyOf(adjustments);
    }

    public static MultiplierSnapshot empty(MultiplierScope scope, Instant computedAt) {
        return new MultiplierSnapshot(scope, Map.of(), List.of(), ScoreDistribution.EMPTY, computedAt);
    }

    public Optional<Double> multiplierFor(String playerKey) {
        return Optional.ofNullable(multipliers.get(playerKey));
    }

    public boolean isEmpty() {
        return multipliers.isEmpty();
    }

    /**
     * Largest movements first, for logging and review.
     */
    public List<MultiplierAdjustment> largestChanges(int limit) {
        return adjustments.stream()
                .sorted(Comparator.comparingDouble((MultiplierAdjustment a) -> Math.abs(a.change())).reversed())
                .limit(limit)
                .toList();
    }
}
