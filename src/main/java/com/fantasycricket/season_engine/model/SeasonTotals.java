package com.fantasycricket.season_engine.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Cumulative season numbers for one player: a field-wise fold over the
 * player's history. Instances handed out are never mutated again; a new
 * match produces a new instance through {@link #plus}, so incremental totals
 * and {@link #replay} of the same history are always identical.
 */
@Getter
@EqualsAndHashCode
@ToString
public class SeasonTotals {

    private int matches;
    private double fantasyPoints;

    // Batting
    private int battingInnings;
    private int runs;
    private int ballsFaced;
    private int fours;
    private int sixes;
    private int dismissals;
    private int highestScore;
    private int fifties;
    private int centuries;
    private int ducks;

    // Bowling
    private int bowlingInnings;
    private int wickets;
    private double overs;
    private int maidens;
    private int runsConceded;
    private int fiveWicketHauls;
    private BowlingFigures bestBowling;

    // Fielding
    private int catches;
    private int stumpings;
    private int runOuts;

    SeasonTotals() {}

    private SeasonTotals(SeasonTotals other) {
        this.matches = other.matches;
        this.fantasyPoints = other.fantasyPoints;
        this.battingInnings = other.battingInnings;
        this.runs = other.runs;
        this.ballsFaced = other.ballsFaced;
        this.fours = other.fours;
        this.sixes = other.sixes;
        this.dismissals = other.dismissals;
        this.highestScore = other.highestScore;
        this.fifties = other.fifties;
        this.centuries = other.centuries;
        this.ducks = other.ducks;
        this.bowlingInnings = other.bowlingInnings;
        this.wickets = other.wickets;
        this.overs = other.overs;
        this.maidens = other.maidens;
        this.runsConceded = other.runsConceded;
        this.fiveWicketHauls = other.fiveWicketHauls;
        this.bestBowling = other.bestBowling;
        this.catches = other.catches;
        this.stumpings = other.stumpings;
        this.runOuts = other.runOuts;
    }

    /** A copy of these totals with one more match folded in. */
    SeasonTotals plus(PerformanceRecord record, ScoreBreakdown score) {
        SeasonTotals next = new SeasonTotals(this);
        next.add(record, score);
        return next;
    }

    private void add(PerformanceRecord record, ScoreBreakdown score) {
        matches++;
        fantasyPoints += score.grandTotal();

        BattingStats batting = record.batting();
        if (batting != null) {
            battingInnings++;
            runs += batting.runs();
            ballsFaced += batting.ballsFaced();
            fours += batting.fours();
            sixes += batting.sixes();
            if (batting.dismissed()) dismissals++;
            highestScore = Math.max(highestScore, batting.runs());
            if (batting.runs() >= 100) {
                centuries++;
            } else if (batting.runs() >= 50) {
                fifties++;
            }
            if (batting.isDuck()) ducks++;
        }

        BowlingStats bowling = record.bowling();
        if (bowling != null) {
            bowlingInnings++;
            wickets += bowling.wickets();
            overs += bowling.overs();
            maidens += bowling.maidens();
            runsConceded += bowling.runsConceded();
            if (bowling.wickets() >= 5) fiveWicketHauls++;
            BowlingFigures figures = new BowlingFigures(bowling.wickets(), bowling.runsConceded());
            if (figures.isBetterThan(bestBowling)) {
                bestBowling = figures;
            }
        }

        FieldingStats fielding = record.fielding();
        if (fielding != null) {
            catches += fielding.catches();
            stumpings += fielding.stumpings();
            runOuts += fielding.runOuts();
        }
    }

    public static SeasonTotals replay(List<HistoryEntry> history) {
        SeasonTotals totals = new SeasonTotals();
        for (HistoryEntry entry : history) {
            totals.add(entry.performance(), entry.score());
        }
        return totals;
    }

    public SeasonAverages averages() {
        return SeasonAverages.from(this);
    }
}
