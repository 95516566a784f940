package com.fantasycricket.season_engine.model;

import java.util.List;

/**
 * The players drafted into one fantasy league. {@code rules} overrides the
 * season rule set for league-scoped points; null means "use the season's".
 */
public record LeagueRoster(String leagueId, List<String> playerKeys, RuleSet rules) {

    public LeagueRoster {
        playerKeys = List.copyOf(playerKeys);
    }

    public LeagueRoster(String leagueId, List<String> playerKeys) {
        this(leagueId, playerKeys, null);
    }

    public MultiplierScope scope() {
        return MultiplierScope.league(leagueId);
    }
}
