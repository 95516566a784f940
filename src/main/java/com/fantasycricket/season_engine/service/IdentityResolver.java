package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.CanonicalPlayer;
import com.fantasycricket.season_engine.model.PerformanceRecord;
import com.fantasycricket.season_engine.model.Provenance;
import com.fantasycricket.season_engine.repository.ClubRegistry;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Maps a scraped performance to a canonical player key.
 *
 * Precedence:
 * 1. Stable identifier already known this season.
 * 2. Name match against the record's club only. Candidates confirmed under a
 *    different stable identifier are skipped. Highest score wins; equal scores
 *    go to the earliest-registered candidate.
 * 3. Mint a new key: the stable identifier if present, otherwise
 *    {@code p_} + the first 12 hex chars of md5(club|normalized name).
 *
 * Resolution never mutates the registry. Callers hold the club lock so that
 * "no match" and the subsequent mint are atomic.
 */
@Service
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);
    private static final int KEY_HASH_LENGTH = 12;

    private final NameMatchRules matchRules;

    public IdentityResolver(NameMatchRules matchRules) {
        this.matchRules = matchRules;
    }

    public IdentityResolution resolve(PerformanceRecord record, ClubRegistry registry) {
        if (!record.hasPlayerName()) {
            throw new IllegalArgumentException(
                    "Performance in match " + record.matchId() + " has no player name");
        }
        Provenance evidence = record.hasStableId() ? Provenance.IDENTIFIER_CONFIRMED : Provenance.NAME_DERIVED;

        // 1. Stable identifier
        if (record.hasStableId()) {
            Optional<CanonicalPlayer> byId = registry.findByStableId(record.playerId());
            if (byId.isPresent()) {
                return matched(byId.get(), IdentityResolution.Kind.STABLE_ID, evidence);
            }
        }

        // 2. Name match within the club
        CanonicalPlayer best = null;
        double bestScore = -1;
        int tiedAtBest = 0;
        for (CanonicalPlayer candidate : registry.players()) {
            if (hasConflictingStableId(candidate, record)) continue;

            OptionalDouble score = matchRules.evaluate(record.playerName(), candidate.getDisplayName());
            if (score.isEmpty()) continue;

            if (score.getAsDouble() > bestScore) {
                best = candidate;
                bestScore = score.getAsDouble();
                tiedAtBest = 0;
            } else if (score.getAsDouble() == bestScore) {
                tiedAtBest++;
            }
        }
        if (best != null) {
            if (tiedAtBest > 0) {
                log.warn("Ambiguous identity for '{}' at {}: {} candidates scored {}, using earliest '{}' ({})",
                        record.playerName(), registry.club(), tiedAtBest + 1,
                        String.format(Locale.ROOT, "%.3f", bestScore), best.getDisplayName(), best.getKey());
            }
            return matched(best, IdentityResolution.Kind.NAME_MATCH, evidence);
        }

        // 3. Mint
        String key = mintKey(record, registry);
        return new IdentityResolution(key, IdentityResolution.Kind.MINTED, evidence, false);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static IdentityResolution matched(CanonicalPlayer player, IdentityResolution.Kind kind,
                                              Provenance evidence) {
        boolean promotes = evidence.outranks(player.getProvenance());
        return new IdentityResolution(player.getKey(), kind, evidence, promotes);
    }

    /** Two different federation ids are two different people. */
    private static boolean hasConflictingStableId(CanonicalPlayer candidate, PerformanceRecord record) {
        return record.hasStableId()
                && candidate.hasStableId()
                && !candidate.getStableId().equals(record.playerId());
    }

    static String mintKey(PerformanceRecord record, ClubRegistry registry) {
        String base;
        if (record.hasStableId()) {
            base = record.playerId();
        } else {
            String club = record.club() == null ? "" : record.club().toLowerCase(Locale.ROOT);
            String digest = DigestUtils.md5Hex(club + "|" + NameNormalizer.normalize(record.playerName()));
            base = "p_" + digest.substring(0, KEY_HASH_LENGTH);
        }

        String key = base;
        int suffix = 2;
        while (registry.isKeyTaken(key)) {
            key = base + "-" + suffix++;
        }
        return key;
    }
}
