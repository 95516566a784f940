package com.fantasycricket.season_engine.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One real player for one season, as resolved from any number of scraped
 * name spellings.
 *
 * The `totals` are folded incrementally from `history`; every mutation goes
 * through {@link #recordPerformance}, which publishes both together as one
 * immutable ledger. Readers never see a history entry whose
 * match is missing from the totals, and never need the player's lock.
 * `multiplier` is the player's current global handicap, written only by a
 * committed handicap pass.
 *
 * Writers hold the player's key lock.
 */
public class CanonicalPlayer {

    private final String key;
    private final String displayName;
    private final String club;
    private volatile String stableId;
    private volatile Provenance provenance;

    private volatile Ledger ledger = Ledger.EMPTY;

    /** Global handicap. League multipliers live in their own snapshots. */
    private volatile double multiplier;

    private final Instant firstSeen;
    private volatile Instant lastUpdated;

    public CanonicalPlayer(String key, String displayName, String club, String stableId,
                           Provenance provenance, double multiplier, Instant firstSeen) {
        this.key = key;
        this.displayName = displayName;
        this.club = club;
        this.stableId = stableId;
        this.provenance = provenance;
        this.multiplier = multiplier;
        this.firstSeen = firstSeen;
        this.lastUpdated = firstSeen;
    }

    // Getters
    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }
    public String getClub() { return club; }
    public String getStableId() { return stableId; }
    public Provenance getProvenance() { return provenance; }
    public Set<String> getProcessedMatchIds() { return ledger.matchIds(); }
    public List<HistoryEntry> getHistory() { return ledger.history(); }
    public SeasonTotals getTotals() { return ledger.totals(); }
    public SeasonAverages getAverages() { return ledger.totals().averages(); }
    public double getSeasonPoints() { return ledger.totals().getFantasyPoints(); }
    public int getMatchesPlayed() { return ledger.totals().getMatches(); }
    public double getMultiplier() { return multiplier; }
    public Instant getFirstSeen() { return firstSeen; }
    public Instant getLastUpdated() { return lastUpdated; }

    public boolean hasStableId() {
        return stableId != null && !stableId.isBlank();
    }

    public boolean hasProcessed(String matchId) {
        return ledger.matchIds().contains(matchId);
    }

    public void recordPerformance(PerformanceRecord record, ScoreBreakdown score, Instant at) {
        Ledger current = ledger;
        if (current.matchIds().contains(record.matchId())) {
            throw new IllegalStateException("Match " + record.matchId() + " already recorded for " + key);
        }
        this.ledger = current.plus(record, score);
        this.lastUpdated = at;
    }

    /**
     * Raise provenance to match new evidence. Never downgrades, and never
     * replaces a stable id that is already set.
     *
     * @return true if provenance changed
     */
    public boolean promote(Provenance evidence, String evidenceStableId) {
        Provenance promoted = provenance.promoteTo(evidence);
        if (promoted == provenance) {
            return false;
        }
        if (promoted == Provenance.IDENTIFIER_CONFIRMED && !hasStableId()) {
            this.stableId = evidenceStableId;
        }
        this.provenance = promoted;
        return true;
    }

    public void updateMultiplier(double newMultiplier) {
        this.multiplier = newMultiplier;
    }

    /** History, applied match ids and totals as of one applied match. */
    private record Ledger(List<HistoryEntry> history, Set<String> matchIds, SeasonTotals totals) {

        static final Ledger EMPTY = new Ledger(List.of(), Set.of(), new SeasonTotals());

        Ledger plus(PerformanceRecord record, ScoreBreakdown score) {
            List<HistoryEntry> nextHistory = new ArrayList<>(history);
            nextHistory.add(new HistoryEntry(record, score));
            Set<String> nextIds = new LinkedHashSet<>(matchIds);
            nextIds.add(record.matchId());
            return new Ledger(
                    Collections.unmodifiableList(nextHistory),
                    Collections.unmodifiableSet(nextIds),
                    totals.plus(record, score));
        }
    }
}
