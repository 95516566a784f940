package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.CanonicalPlayer;
import com.fantasycricket.season_engine.model.LegacyPlayer;
import com.fantasycricket.season_engine.model.PerformanceRecord;
import com.fantasycricket.season_engine.model.Provenance;
import com.fantasycricket.season_engine.model.RuleSet;
import com.fantasycricket.season_engine.model.ScoreBreakdown;
import com.fantasycricket.season_engine.model.SeasonScope;
import com.fantasycricket.season_engine.repository.MultiplierSnapshotRepository;
import com.fantasycricket.season_engine.repository.PlayerRepository;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Owns the per-player state of one season.
 *
 * Flow for each record:
 * 1. Under the club lock: resolve identity, mint or promote.
 * 2. Under the player lock: skip if the match id was already applied,
 *    otherwise score it and fold it into history and totals.
 *
 * Every ingest holds the read side of the season barrier; a handicap pass
 * takes the write side (see {@link #withIngestionPaused}) so it snapshots
 * points that no worker is halfway through updating.
 *
 * Lock order is always club, then player. Folding never takes a club lock.
 */
public class SeasonAggregator {

    private static final Logger log = LoggerFactory.getLogger(SeasonAggregator.class);
    private static final int SUMMARY_TOP_SCORERS = 10;

    private final PlayerRepository playerRepository;
    private final MultiplierSnapshotRepository snapshotRepository;
    private final IdentityResolver identityResolver;
    private final ScoringEngine scoringEngine;
    private final RuleSet ruleSet;
    private final Clock clock;

    private final KeyedLocks clubLocks = new KeyedLocks();
    private final KeyedLocks playerLocks = new KeyedLocks();
    private final ReentrantReadWriteLock seasonBarrier = new ReentrantReadWriteLock();

    public SeasonAggregator(PlayerRepository playerRepository,
                            MultiplierSnapshotRepository snapshotRepository,
                            IdentityResolver identityResolver,
                            ScoringEngine scoringEngine,
                            RuleSet ruleSet,
                            Clock clock) {
        this.playerRepository = playerRepository;
        this.snapshotRepository = snapshotRepository;
        this.identityResolver = identityResolver;
        this.scoringEngine = scoringEngine;
        this.ruleSet = ruleSet;
        this.clock = clock;
    }

    public SeasonScope getScope() { return playerRepository.getScope(); }
    public RuleSet getRuleSet() { return ruleSet; }
    public PlayerRepository getPlayerRepository() { return playerRepository; }
    public MultiplierSnapshotRepository getSnapshotRepository() { return snapshotRepository; }

    // =========================================================================
    // Ingestion
    // =========================================================================

    /**
     * Apply one performance and return the player it belongs to. Re-applying
     * the same match id for the same player is a no-op.
     */
    public CanonicalPlayer addPerformance(PerformanceRecord record) {
        return ingest(record).player();
    }

    public IngestionOutcome ingest(PerformanceRecord record) {
        seasonBarrier.readLock().lock();
        try {
            Resolved resolved = clubLocks.withLock(clubKey(record.club()), () -> resolveOrMint(record));
            return playerLocks.withLock(resolved.player().getKey(), () -> fold(resolved, record));
        } finally {
            seasonBarrier.readLock().unlock();
        }
    }

    private Resolved resolveOrMint(PerformanceRecord record) {
        IdentityResolution resolution = identityResolver.resolve(
                record, playerRepository.clubRegistry(clubKey(record.club())));

        if (resolution.isMinted()) {
            CanonicalPlayer minted = new CanonicalPlayer(
                    resolution.playerKey(),
                    record.playerName().trim(),
                    clubKey(record.club()),
                    record.hasStableId() ? record.playerId() : null,
                    resolution.evidence(),
                    ruleSet.getNeutralMultiplier(),
                    clock.instant());
            CanonicalPlayer registered = playerRepository.save(minted);
            if (registered == minted) {
                log.info("New player discovered in {}: {} ({}) at {}",
                        getScope(), minted.getDisplayName(), minted.getKey(), minted.getClub());
                return new Resolved(registered, resolution.kind());
            }
            // Same stable id minted concurrently from another club
            promoteIfStronger(registered, resolution.evidence(), record.playerId());
            return new Resolved(registered, IdentityResolution.Kind.STABLE_ID);
        }

        CanonicalPlayer player = playerRepository.findByKey(resolution.playerKey())
                .orElseThrow(() -> new IllegalStateException(
                        "Resolved key " + resolution.playerKey() + " is not registered in " + getScope()));
        if (resolution.promotesPlayer()) {
            promoteIfStronger(player, resolution.evidence(), record.playerId());
        }
        return new Resolved(player, resolution.kind());
    }

    private void promoteIfStronger(CanonicalPlayer player, Provenance evidence, String stableId) {
        Provenance before = player.getProvenance();
        boolean promoted = playerLocks.withLock(player.getKey(), () -> {
            boolean changed = player.promote(evidence, stableId);
            if (changed) {
                playerRepository.save(player);
            }
            return changed;
        });
        if (promoted) {
            log.info("Promoted {} ({}) from {} to {}",
                    player.getDisplayName(), player.getKey(), before, player.getProvenance());
        }
    }

    private IngestionOutcome fold(Resolved resolved, PerformanceRecord record) {
        CanonicalPlayer player = resolved.player();
        if (player.hasProcessed(record.matchId())) {
            log.debug("Skipping duplicate match {} for {}", record.matchId(), player.getKey());
            return new IngestionOutcome(player, IngestionOutcome.Status.DUPLICATE, resolved.kind());
        }

        ScoreBreakdown score = scoringEngine.score(record, ruleSet);
        player.recordPerformance(record, score, clock.instant());
        log.debug("Applied match {} to {}: +{} ({} total)",
                record.matchId(), player.getKey(), score.grandTotal(), player.getSeasonPoints());
        return new IngestionOutcome(player, IngestionOutcome.Status.APPLIED, resolved.kind());
    }

    private static String clubKey(String club) {
        return club == null ? "" : club.trim();
    }

    private record Resolved(CanonicalPlayer player, IdentityResolution.Kind kind) {}

    // =========================================================================
    // Legacy roster
    // =========================================================================

    /**
     * Seed returning players with empty totals so this season's scorecards
     * match them by name. Entries without a name or club are skipped; players
     * already registered are left untouched.
     *
     * @return number of players created
     */
    public int importLegacyRoster(List<LegacyPlayer> roster) {
        int created = 0;
        for (LegacyPlayer legacy : roster) {
            if (legacy.name() == null || legacy.name().isBlank()
                    || legacy.club() == null || legacy.club().isBlank()) {
                log.warn("Skipping legacy roster entry without name or club: {}", legacy);
                continue;
            }
            String club = clubKey(legacy.club());
            boolean hasId = legacy.playerId() != null && !legacy.playerId().isBlank();
            String key = hasId
                    ? legacy.playerId()
                    : "legacy_" + DigestUtils.md5Hex(club.toLowerCase(Locale.ROOT) + "|"
                            + NameNormalizer.normalize(legacy.name())).substring(0, 12);

            boolean added = clubLocks.withLock(club, () -> {
                if (playerRepository.existsByKey(key)
                        || (hasId && playerRepository.findByStableId(legacy.playerId()).isPresent())) {
                    return false;
                }
                CanonicalPlayer shell = new CanonicalPlayer(
                        key, legacy.name().trim(), club, hasId ? legacy.playerId() : null,
                        Provenance.LEGACY_IMPORT, ruleSet.getNeutralMultiplier(), clock.instant());
                return playerRepository.save(shell) == shell;
            });
            if (added) created++;
        }
        log.info("Imported {} legacy players into {} ({} entries supplied)", created, getScope(), roster.size());
        return created;
    }

    // =========================================================================
    // Handicap support
    // =========================================================================

    /**
     * Run {@code pass} with all ingestion blocked. Records already inside
     * {@link #ingest} finish first.
     */
    public <T> T withIngestionPaused(Supplier<T> pass) {
        seasonBarrier.writeLock().lock();
        try {
            return pass.get();
        } finally {
            seasonBarrier.writeLock().unlock();
        }
    }

    /** Season points per player key, in registration order. */
    public Map<String, Double> snapshotSeasonPoints() {
        Map<String, Double> points = new LinkedHashMap<>();
        for (CanonicalPlayer player : playerRepository.findAll()) {
            points.put(player.getKey(), player.getSeasonPoints());
        }
        return points;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public Optional<CanonicalPlayer> getPlayer(String key) {
        return playerRepository.findByKey(key);
    }

    public List<CanonicalPlayer> getPlayersByClub(String club) {
        return playerRepository.findByClub(clubKey(club));
    }

    /**
     * Players ranked by {@code metric}, highest first. Safe to call while
     * ingesting: each player's value is read once, so the ranking reflects a
     * single reading per player.
     */
    public List<CanonicalPlayer> getTopPlayers(PlayerMetric metric, int limit) {
        return rank(metric, limit).stream().map(Ranked::player).toList();
    }

    public SeasonSummary getSummary() {
        Map<String, Integer> rosterSizes = new LinkedHashMap<>();
        for (String club : playerRepository.findAllClubs()) {
            rosterSizes.put(club, playerRepository.findByClub(club).size());
        }
        List<TopScorer> topScorers = rank(PlayerMetric.FANTASY_POINTS, SUMMARY_TOP_SCORERS).stream()
                .map(r -> new TopScorer(r.player().getKey(), r.player().getDisplayName(),
                        r.player().getClub(), r.value()))
                .toList();
        return new SeasonSummary(getScope(), playerRepository.count(), rosterSizes, topScorers);
    }

    private List<Ranked> rank(PlayerMetric metric, int limit) {
        return playerRepository.findAll().stream()
                .map(p -> new Ranked(p, metric.extract(p)))
                .sorted(Comparator.comparingDouble(Ranked::value).reversed())
                .limit(limit)
                .toList();
    }

    private record Ranked(CanonicalPlayer player, double value) {}

    // =========================================================================
    // Result DTOs
    // =========================================================================

    public record SeasonSummary(
            SeasonScope scope,
            long totalPlayers,
            Map<String, Integer> clubRosterSizes,
            List<TopScorer> topScorers
    ) {}

    public record TopScorer(String key, String name, String club, double points) {}
}
