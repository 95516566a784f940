package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.PerformanceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Batch entry point for scraped performances.
 *
 * Malformed records (no player name, club or match id) are dropped and
 * counted. The rest are grouped by club; each club is one task on the shared
 * ingestion pool, so a club's records are applied in submission order while
 * different clubs proceed in parallel.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final ExecutorService ingestionExecutor;

    public IngestionService(@Qualifier("ingestionExecutor") ExecutorService ingestionExecutor) {
        this.ingestionExecutor = ingestionExecutor;
    }

    public IngestionReport ingestBatch(SeasonAggregator season, List<PerformanceRecord> records) {
        Map<String, List<PerformanceRecord>> byClub = new LinkedHashMap<>();
        int malformed = 0;
        for (PerformanceRecord record : records) {
            if (isMalformed(record)) {
                malformed++;
                log.warn("Dropping malformed record for match {} (player '{}', club '{}')",
                        record.matchId(), record.playerName(), record.club());
                continue;
            }
            byClub.computeIfAbsent(record.club().trim(), c -> new ArrayList<>()).add(record);
        }

        if (byClub.isEmpty()) {
            return new IngestionReport(records.size(), 0, 0, malformed, 0, Set.of());
        }

        List<Callable<ClubResult>> tasks = new ArrayList<>();
        byClub.forEach((club, clubRecords) -> tasks.add(() -> ingestClub(season, club, clubRecords)));
        try {
            // invokeAll waits for every club and cancels the rest if interrupted
            List<Future<ClubResult>> futures = ingestionExecutor.invokeAll(tasks);

            int applied = 0;
            int duplicates = 0;
            int newPlayers = 0;
            Set<String> touched = new LinkedHashSet<>();
            for (Future<ClubResult> future : futures) {
                ClubResult result = future.get();
                applied += result.applied();
                duplicates += result.duplicates();
                newPlayers += result.newPlayers();
                touched.addAll(result.touchedKeys());
            }

            IngestionReport report = new IngestionReport(
                    records.size(), applied, duplicates, malformed, newPlayers, touched);
            log.info("Ingested batch into {}: {} submitted, {} applied, {} duplicate, {} malformed, {} new players",
                    season.getScope(), report.submitted(), applied, duplicates, malformed, newPlayers);
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionException("Ingestion into " + season.getScope() + " was interrupted", e);
        } catch (ExecutionException e) {
            throw new IngestionException("Ingestion into " + season.getScope() + " failed", e.getCause());
        }
    }

    private ClubResult ingestClub(SeasonAggregator season, String club, List<PerformanceRecord> records) {
        int applied = 0;
        int duplicates = 0;
        int newPlayers = 0;
        Set<String> touched = new LinkedHashSet<>();
        for (PerformanceRecord record : records) {
            IngestionOutcome outcome = season.ingest(record);
            if (outcome.isApplied()) {
                applied++;
                touched.add(outcome.player().getKey());
                if (outcome.resolvedBy() == IdentityResolution.Kind.MINTED) {
                    newPlayers++;
                }
            } else {
                duplicates++;
            }
        }
        log.debug("Club {}: {} applied, {} duplicate", club, applied, duplicates);
        return new ClubResult(applied, duplicates, newPlayers, touched);
    }

    static boolean isMalformed(PerformanceRecord record) {
        return !record.hasPlayerName()
                || record.club() == null || record.club().isBlank()
                || record.matchId() == null || record.matchId().isBlank();
    }

    private record ClubResult(int applied, int duplicates, int newPlayers, Set<String> touchedKeys) {}

    // =========================================================================
    // Result DTO
    // =========================================================================

    public record IngestionReport(
            int submitted,
            int applied,
            int duplicates,
            int malformed,
            int newPlayers,
            Set<String> touchedPlayerKeys
    ) {
        public IngestionReport {
            touchedPlayerKeys = Set.copyOf(touchedPlayerKeys);
        }
    }
}
