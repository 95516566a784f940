package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.MultiplierAdjustment;
import com.fantasycricket.season_engine.model.MultiplierScope;
import com.fantasycricket.season_engine.model.MultiplierSnapshot;
import com.fantasycricket.season_engine.model.RuleSet;
import com.fantasycricket.season_engine.model.ScoreDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes a new multiplier snapshot for one scope from season points and the
 * previous multipliers. Pure apart from the timestamp; persisting the result
 * is the caller's job.
 */
@Service
public class HandicapEngine {

    private static final Logger log = LoggerFactory.getLogger(HandicapEngine.class);

    private final Clock clock;

    public HandicapEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param seasonPoints         player key to season points, in output order
     * @param previousMultipliers  player key to last multiplier; players
     *                             missing here start from neutral
     */
    public MultiplierSnapshot adjust(MultiplierScope scope,
                                     Map<String, Double> seasonPoints,
                                     Map<String, Double> previousMultipliers,
                                     RuleSet rules) {
        if (seasonPoints.isEmpty()) {
            log.debug("No players in {}, returning empty snapshot", scope);
            return MultiplierSnapshot.empty(scope, clock.instant());
        }

        ScoreDistribution distribution = HandicapCalculator.distribution(seasonPoints.values());
        if (distribution.isEmpty() || distribution.min() == distribution.max()) {
            log.debug("Degenerate score distribution in {} ({} scoring players), all targets neutral",
                    scope, distribution.count());
        }

        Map<String, Double> multipliers = new LinkedHashMap<>();
        List<MultiplierAdjustment> adjustments = new ArrayList<>(seasonPoints.size());
        for (Map.Entry<String, Double> entry : seasonPoints.entrySet()) {
            String key = entry.getKey();
            double score = entry.getValue();
            double previous = previousMultipliers.getOrDefault(key, rules.getNeutralMultiplier());

            double target = HandicapCalculator.targetMultiplier(score, distribution, rules);
            double updated = HandicapCalculator.blend(previous, target, rules);

            multipliers.put(key, updated);
            adjustments.add(new MultiplierAdjustment(key, score, previous, HandicapCalculator.round2(target), updated));
        }
        return new MultiplierSnapshot(scope, multipliers, adjustments, distribution, clock.instant());
    }
}
