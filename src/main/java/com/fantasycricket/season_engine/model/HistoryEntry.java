package com.fantasycricket.season_engine.model;

public record HistoryEntry(PerformanceRecord performance, ScoreBreakdown score) {
}
