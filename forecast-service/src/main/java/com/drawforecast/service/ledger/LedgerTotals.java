package com.drawforecast.service.ledger;

/**
 * Lifetime counters of the ledger. {@code totalPredictions} includes pending and discarded entries.
 */
public record LedgerTotals(long totalPredictions, long wins, long losses, int pending) {

    public double winRate() {
        long resolved = wins + losses;
        return resolved == 0 ? 0.0 : (double) wins / resolved;
    }
}
