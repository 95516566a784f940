package com.fantasycricket.season_engine.service;

import com.fantasycricket.season_engine.model.CanonicalPlayer;

/**
 * What {@link SeasonAggregator#ingest} did with one record.
 */
public record IngestionOutcome(CanonicalPlayer player, Status status, IdentityResolution.Kind resolvedBy) {

    public enum Status {
        APPLIED,
        DUPLICATE
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
