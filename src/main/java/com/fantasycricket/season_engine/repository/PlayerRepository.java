package com.fantasycricket.season_engine.repository;

import com.fantasycricket.season_engine.model.CanonicalPlayer;
import com.fantasycricket.season_engine.model.SeasonScope;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical players for a single season. Implementations keep per-club
 * registration order, which identity resolution relies on to break ties.
 */
public interface PlayerRepository {

    SeasonScope getScope();

    Optional<CanonicalPlayer> findByKey(String key);

    Optional<CanonicalPlayer> findByStableId(String stableId);

    boolean existsByKey(String key);

    /**
     * Register a new player, or re-index an existing one after its stable id
     * changed. Registration order is fixed by the first call.
     *
     * @return the registered instance, which is a different object when
     *         another player already holds the same key
     */
    CanonicalPlayer save(CanonicalPlayer player);

    // =========================================================================
    // Listing
    // =========================================================================

    /** Players of one club, earliest-registered first. */
    List<CanonicalPlayer> findByClub(String club);

    /** All players, earliest-registered first. */
    List<CanonicalPlayer> findAll();

    Set<String> findAllClubs();

    long count();

    /**
     * Read view used by identity resolution for one club.
     */
    ClubRegistry clubRegistry(String club);
}
