package com.fantasycricket.season_engine.repository;

import com.fantasycricket.season_engine.model.CanonicalPlayer;

import java.util.List;
import java.util.Optional;

/**
 * What the identity resolver may see: the candidates of one club for fuzzy
 * matching, plus season-wide lookups by stable id and key (stable ids are
 * federation-wide, so a transfer keeps its identity).
 */
public interface ClubRegistry {

    String club();

    /** Candidates in registration order. */
    List<CanonicalPlayer> players();

    Optional<CanonicalPlayer> findByStableId(String stableId);

    boolean isKeyTaken(String key);
}
