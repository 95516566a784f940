package com.fantasycricket.season_engine.model;

public enum LeadershipRole {
    NONE,
    CAPTAIN,
    VICE_CAPTAIN
}
