package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.RuleSet;
import com.fantasycricket.season_engine.model.SeasonScope;
import com.fantasycricket.season_engine.repository.InMemoryMultiplierSnapshotRepository;
import com.fantasycricket.season_engine.repository.InMemoryPlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One independent {@link SeasonAggregator} per season. Nothing is shared
 * between seasons except the stateless scoring and resolution services.
 */
@Service
public class SeasonRegistry {

    private static final Logger log = LoggerFactory.getLogger(SeasonRegistry.class);

    private final IdentityResolver identityResolver;
    private final ScoringEngine scoringEngine;
    private final RuleSet ruleSet;
    private final Clock clock;

    private final Map<SeasonScope, SeasonAggregator> seasons = new ConcurrentHashMap<>();

    public SeasonRegistry(IdentityResolver identityResolver,
                          ScoringEngine scoringEngine,
                          RuleSet ruleSet,
                          Clock clock) {
        this.identityResolver = identityResolver;
        this.scoringEngine = scoringEngine;
        this.ruleSet = ruleSet;
        this.clock = clock;
    }

    /** The season's aggregator, created empty on first use. */
    public SeasonAggregator forSeason(SeasonScope scope) {
        return seasons.computeIfAbsent(scope, this::open);
    }

    public Optional<SeasonAggregator> find(SeasonScope scope) {
        return Optional.ofNullable(seasons.get(scope));
    }

    public Set<SeasonScope> activeSeasons() {
        return Set.copyOf(seasons.keySet());
    }

    /**
     * Drop a season's state at the season boundary.
     *
     * @return true if the season was open
     */
    public boolean close(SeasonScope scope) {
        boolean removed = seasons.remove(scope) != null;
        if (removed) {
            log.info("Closed season {}", scope);
        }
        return removed;
    }

    private SeasonAggregator open(SeasonScope scope) {
        log.info("Opening season {}", scope);
        return new SeasonAggregator(
                new InMemoryPlayerRepository(scope),
                new InMemoryMultiplierSnapshotRepository(),
                identityResolver,
                scoringEngine,
                ruleSet,
                clock);
    }
}
