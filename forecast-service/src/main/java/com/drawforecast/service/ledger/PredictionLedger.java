package com.drawforecast.service.ledger;

import com.drawforecast.common.model.EnsembleDecision;
import com.drawforecast.common.resolution.ResolutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory record of issued decisions, newest first.
 *
 * <p>Holds at most {@value #MAX_ENTRIES} entries; the oldest entry is dropped first. The set of
 * predicted periods backs per-period de-duplication and is cleared on period resynchronisation.
 * Readers receive copies, never the live entries.
 */
@Component
public class PredictionLedger {

    private static final Logger log = LoggerFactory.getLogger(PredictionLedger.class);

    static final int MAX_ENTRIES = 500;

    private final Clock clock;
    private final Deque<TrackedPrediction> entries = new ArrayDeque<>();
    private final Set<String> predictedPeriods = new HashSet<>();

    private long totalPredictions;
    private long wins;
    private long losses;

    public PredictionLedger(Clock forecastClock) {
        this.clock = forecastClock;
    }

    /**
     * Records a decision bound to its target period as PENDING.
     *
     * @throws IllegalArgumentException when the decision has no period
     */
    public synchronized TrackedPrediction record(EnsembleDecision decision) {
        if (decision.period() == null) {
            throw new IllegalArgumentException("decision must be bound to a period before it is recorded");
        }
        TrackedPrediction entry = TrackedPrediction.builder()
            .id(UUID.randomUUID().toString())
            .period(decision.period())
            .prediction(decision.prediction())
            .confidencePercent(decision.confidencePercent())
            .tier(decision.tier())
            .recommendation(decision.recommendation())
            .agreementPercent(decision.agreementPercent())
            .marketCondition(decision.marketCondition())
            .recoveryMode(decision.recoveryMode())
            .status(PredictionStatus.PENDING)
            .createdAt(clock.instant())
            .decision(decision)
            .build();

        entries.addFirst(entry);
        predictedPeriods.add(entry.getPeriod());
        totalPredictions++;
        while (entries.size() > MAX_ENTRIES) {
            TrackedPrediction evicted = entries.removeLast();
            predictedPeriods.remove(evicted.getPeriod());
        }
        log.info("Prediction recorded. period={} prediction={} confidence={}% tier={}",
                 entry.getPeriod(), entry.getPrediction(), entry.getConfidencePercent(), entry.getTier());
        return entry.toBuilder().build();
    }

    public synchronized boolean hasPredicted(String period) {
        return predictedPeriods.contains(period);
    }

    public synchronized Optional<TrackedPrediction> find(String period) {
        return entries.stream()
            .filter(e -> e.getPeriod().equals(period))
            .findFirst()
            .map(e -> e.toBuilder().build());
    }

    public synchronized Optional<TrackedPrediction> newest() {
        return Optional.ofNullable(entries.peekFirst()).map(e -> e.toBuilder().build());
    }

    /** Pending entries, oldest first, so they resolve in draw order. */
    public synchronized List<TrackedPrediction> pending() {
        List<TrackedPrediction> pending = new ArrayList<>();
        Iterator<TrackedPrediction> it = entries.descendingIterator();
        while (it.hasNext()) {
            TrackedPrediction entry = it.next();
            if (entry.getStatus() == PredictionStatus.PENDING) {
                pending.add(entry.toBuilder().build());
            }
        }
        return pending;
    }

    /**
     * Applies a resolution to the pending entry of its period.
     *
     * @return {@code false} when no pending entry exists for the period
     */
    public synchronized boolean markResolved(ResolutionOutcome outcome) {
        for (TrackedPrediction entry : entries) {
            if (entry.getPeriod().equals(outcome.period()) && entry.getStatus() == PredictionStatus.PENDING) {
                entry.setStatus(outcome.win() ? PredictionStatus.WIN : PredictionStatus.LOSS);
                entry.setActual(outcome.actual());
                entry.setActualDigit(outcome.actualDigit());
                entry.setResolvedAt(clock.instant());
                if (outcome.win()) wins++;
                else losses++;
                return true;
            }
        }
        return false;
    }

    /**
     * Drops every pending entry and forgets all predicted periods.
     *
     * @return number of discarded entries
     */
    public synchronized int discardPending() {
        int before = entries.size();
        entries.removeIf(e -> e.getStatus() == PredictionStatus.PENDING);
        predictedPeriods.clear();
        return before - entries.size();
    }

    /** Newest-first copies of at most {@code limit} entries. */
    public synchronized List<TrackedPrediction> history(int limit) {
        return entries.stream()
            .limit(Math.max(0, limit))
            .map(e -> e.toBuilder().build())
            .toList();
    }

    public synchronized LedgerTotals totals() {
        int pending = (int) entries.stream().filter(e -> e.getStatus() == PredictionStatus.PENDING).count();
        return new LedgerTotals(totalPredictions, wins, losses, pending);
    }
}
