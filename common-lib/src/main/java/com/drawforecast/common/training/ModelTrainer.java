package com.drawforecast.common.training;

import com.drawforecast.common.analysis.MarketStateAnalyzer;
import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.exception.TrainingException;
import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.OutcomeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Rebuilds the pattern table, the Markov table and the trend windows from the current
 * buffer, then re-runs the {@link MarketStateAnalyzer}.
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li><b>Full rebuild</b>. Every pass builds fresh tables from a buffer snapshot; nothing
 *       from the previous generation is merged in.</li>
 *   <li><b>Single flight</b>. A call made while a pass is running returns {@code false}
 *       at once and changes nothing.</li>
 *   <li><b>All or nothing</b>. The new tables and market state are published together
 *       after every step succeeded; on failure the previous generation stays in place.</li>
 * </ul>
 *
 * <p>Table semantics: for every window of length L starting at index i of the newest-first
 * buffer, the digit at index i + L is recorded as the window's follower.
 */
public class ModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainer.class);

    private final ForecastContext context;
    private final MarketStateAnalyzer analyzer;
    private final Clock clock;

    private final AtomicBoolean training = new AtomicBoolean(false);
    private final AtomicLong completedPasses = new AtomicLong();
    private volatile Instant lastSuccess = Instant.EPOCH;

    public ModelTrainer(ForecastContext context, MarketStateAnalyzer analyzer) {
        this(context, analyzer, Clock.systemUTC());
    }

    public ModelTrainer(ForecastContext context, MarketStateAnalyzer analyzer, Clock clock) {
        this.context  = context;
        this.analyzer = analyzer;
        this.clock    = clock;
    }

    /**
     * Runs one training pass.
     *
     * @return {@code true} when a new generation was published; {@code false} when another
     *         pass was already running or this pass failed
     */
    public boolean run() {
        if (!training.compareAndSet(false, true)) {
            log.info("Training already in progress, skipping trigger");
            return false;
        }
        long started = System.nanoTime();
        try {
            List<OutcomeRecord> snapshot = context.buffer().records();

            OccurrenceTable patterns = step("pattern", () ->
                buildPatternTable(snapshot, context.settings().patternLengths()));
            OccurrenceTable markov = step("markov", () ->
                buildMarkovTable(snapshot, context.settings().markovOrder()));
            TrendWindows windows = step("trend", () -> TrendWindows.from(snapshot));
            MarketState state = step("market", () -> analyzer.analyze(snapshot, context.marketState()));

            context.publish(new TrainedModels(patterns, markov, windows, clock.instant()), state);
            completedPasses.incrementAndGet();
            lastSuccess = clock.instant();

            log.info("Model training complete. records={} patterns={} markovStates={} trend={} exploitable={} durationMs={}",
                     snapshot.size(), patterns.size(), markov.size(), state.recentTrend(), state.exploitable(),
                     (System.nanoTime() - started) / 1_000_000);
            return true;
        } catch (RuntimeException e) {
            log.error("Model training failed, keeping previous models", e);
            return false;
        } finally {
            training.set(false);
        }
    }

    public boolean isTraining() {
        return training.get();
    }

    public long completedPasses() {
        return completedPasses.get();
    }

    public Instant lastSuccess() {
        return lastSuccess;
    }

    // ── Table builders ──────────────────────────────────────────────────────

    static OccurrenceTable buildPatternTable(List<OutcomeRecord> records, List<Integer> lengths) {
        OccurrenceTable.Builder builder = OccurrenceTable.builder();
        for (int length : lengths) {
            for (int i = 0; i <= records.size() - length - 1; i++) {
                String key = OccurrenceTable.key(records, i, length, OccurrenceTable.PATTERN_SEPARATOR);
                builder.record(key, records.get(i + length).digit());
            }
        }
        return builder.build();
    }

    static OccurrenceTable buildMarkovTable(List<OutcomeRecord> records, int maxOrder) {
        OccurrenceTable.Builder builder = OccurrenceTable.builder();
        for (int order = 1; order <= maxOrder; order++) {
            for (int i = 0; i <= records.size() - order - 1; i++) {
                String key = OccurrenceTable.key(records, i, order, OccurrenceTable.MARKOV_SEPARATOR);
                builder.record(key, records.get(i + order).digit());
            }
        }
        return builder.build();
    }

    private static <T> T step(String name, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            throw new TrainingException(name, "training step failed: " + e.getMessage(), e);
        }
    }
}
