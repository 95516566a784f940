package com.fantasycricket.season_engine.repository;

import com.fantasycricket.season_engine.model.CanonicalPlayer;
import com.fantasycricket.season_engine.model.SeasonScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Season-scoped player store backed by concurrent maps.
 *
 * Per-club key lists are append-only {@link CopyOnWriteArrayList}s so a
 * resolver can iterate candidates while another club's worker registers.
 */
public class InMemoryPlayerRepository implements PlayerRepository {

    private final SeasonScope scope;
    private final Map<String, CanonicalPlayer> playersByKey = new ConcurrentHashMap<>();
    private final Map<String, String> keysByStableId = new ConcurrentHashMap<>();
    private final Map<String, List<String>> keysByClub = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();

    public InMemoryPlayerRepository(SeasonScope scope) {
        this.scope = scope;
    }

    @Override
    public SeasonScope getScope() {
        return scope;
    }

    @Override
    public Optional<CanonicalPlayer> findByKey(String key) {
        return Optional.ofNullable(playersByKey.get(key));
    }

    @Override
    public Optional<CanonicalPlayer> findByStableId(String stableId) {
        if (stableId == null) return Optional.empty();
        String key = keysByStableId.get(stableId);
        return key == null ? Optional.empty() : findByKey(key);
    }

    @Override
    public boolean existsByKey(String key) {
        return playersByKey.containsKey(key);
    }

    @Override
    public CanonicalPlayer save(CanonicalPlayer player) {
        CanonicalPlayer existing = playersByKey.putIfAbsent(player.getKey(), player);
        if (existing != null && existing != player) {
            return existing;
        }
        if (existing == null) {
            keysByClub.computeIfAbsent(player.getClub(), c -> new CopyOnWriteArrayList<>()).add(player.getKey());
            registrationOrder.add(player.getKey());
        }
        if (player.hasStableId()) {
            keysByStableId.putIfAbsent(player.getStableId(), player.getKey());
        }
        return player;
    }

    // =========================================================================
    // Listing
    // =========================================================================

    @Override
    public List<CanonicalPlayer> findByClub(String club) {
        return resolve(keysByClub.getOrDefault(club, List.of()));
    }

    @Override
    public List<CanonicalPlayer> findAll() {
        return resolve(registrationOrder);
    }

    @Override
    public Set<String> findAllClubs() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(keysByClub.keySet()));
    }

    @Override
    public long count() {
        return playersByKey.size();
    }

    @Override
    public ClubRegistry clubRegistry(String club) {
        return new ClubView(club);
    }

    private List<CanonicalPlayer> resolve(List<String> keys) {
        List<CanonicalPlayer> players = new ArrayList<>(keys.size());
        for (String key : keys) {
            players.add(playersByKey.get(key));
        }
        return players;
    }

    private class ClubView implements ClubRegistry {

        private final String club;

        ClubView(String club) {
            this.club = club;
        }

        @Override
        public String club() {
            return club;
        }

        @Override
        public List<CanonicalPlayer> players() {
            return findByClub(club);
        }

        @Override
        public Optional<CanonicalPlayer> findByStableId(String stableId) {
            return InMemoryPlayerRepository.this.findByStableId(stableId);
        }

        @Override
        public boolean isKeyTaken(String key) {
            return existsByKey(key);
        }
    }
}
