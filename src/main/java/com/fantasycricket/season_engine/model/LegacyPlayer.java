package com.fantasycricket.season_engine.model;

/**
 * A returning player from a previous season's roster. {@code playerId}
 * is optional.
 */
public record LegacyPlayer(String playerId, String name, String club) {
}
