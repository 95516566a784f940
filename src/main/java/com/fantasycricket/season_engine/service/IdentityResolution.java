package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.Provenance;

/**
 * Outcome of resolving one performance record to a canonical key.
 *
 * @param evidence        the provenance the record itself supports
 * @param promotesPlayer  true when the matched player's provenance is weaker
 *                        than {@code evidence} and should be raised
 */
public record IdentityResolution(String playerKey, Kind kind, Provenance evidence, boolean promotesPlayer) {

    public enum Kind {
        STABLE_ID,
        NAME_MATCH,
        MINTED
    }

    public boolean isMinted() {
        return kind == Kind.MINTED;
    }
}
