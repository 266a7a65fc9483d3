package com.drawforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Consecutive win/loss counters of the ensemble's resolved decisions.
 * Mutated only by outcome resolution.
 */
public final class RunStreak {

    private int consecutiveWins;
    private int consecutiveLosses;

    public synchronized void recordWin() {
        consecutiveWins++;
        consecutiveLosses = 0;
    }

    public synchronized void recordLoss() {
        consecutiveLosses++;
        consecutiveWins = 0;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(consecutiveWins, consecutiveLosses);
    }

    public record Snapshot(
        @JsonProperty("consecutiveWins")   int consecutiveWins,
        @JsonProperty("consecutiveLosses") int consecutiveLosses
    ) {
        public static Snapshot clean() {
            return new Snapshot(0, 0);
        }
    }
}
