package com.fantasycricket.season_engine.model;

/**
 * The comparison group a multiplier snapshot was computed over:
 * the whole season, or one league's roster.
 */
public record MultiplierScope(Kind kind, String leagueId) {

    public enum Kind { GLOBAL, LEAGUE }

    public static final MultiplierScope GLOBAL = new MultiplierScope(Kind.GLOBAL, null);

    public MultiplierScope {
        if (kind == Kind.LEAGUE && (leagueId == null || leagueId.isBlank())) {
            throw new IllegalArgumentException("League scope requires a league id");
        }
        if (kind == Kind.GLOBAL) {
            leagueId = null;
        }
    }

    public static MultiplierScope league(String leagueId) {
        return new MultiplierScope(Kind.LEAGUE, leagueId);
    }

    public boolean isGlobal() {
        return kind == Kind.GLOBAL;
    }

    @Override
    public String toString() {
        return isGlobal() ? "global" : "league:" + leagueId;
    }
}
