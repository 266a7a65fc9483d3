package com.drawforecast.service.service;

import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.ensemble.EnsembleAggregator;
import com.drawforecast.common.model.EnsembleDecision;
import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.model.RunStreak;
import com.drawforecast.common.period.PeriodSequence;
import com.drawforecast.common.training.ModelTrainer;
import com.drawforecast.service.client.DrawFeed;
import com.drawforecast.service.dto.ForecastStatsDTO;
import com.drawforecast.service.ledger.LedgerTotals;
import com.drawforecast.service.ledger.PredictionLedger;
import com.drawforecast.service.ledger.TrackedPrediction;
import com.drawforecast.service.sync.PeriodSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Optional;

/**
 * Drives the forecasting core from the draw feed.
 *
 * <p>Every cycle fetches the feed asynchronously and then runs its synchronous part
 * (ingest, resolution, period sync, training, prediction) on the single forecast-cycle
 * scheduler, so cycles triggered by HTTP requests and by the scheduler never interleave.
 *
 * <pre>
 *   next()          fetch → ingest (+train if new) → resolve → sync → predict next period
 *   checkResults()  fetch → ingest (+train if new) → resolve → sync
 *   learn()         fetch → ingest → train
 * </pre>
 */
@Service
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final ForecastContext context;
    private final DrawFeed drawFeed;
    private final ModelTrainer trainer;
    private final EnsembleAggregator aggregator;
    private final PredictionLedger ledger;
    private final PeriodSynchronizer synchronizer;
    private final ResolutionService resolutionService;
    private final Scheduler cycleScheduler;
    private final int minRecords;

    public ForecastService(ForecastContext context, DrawFeed drawFeed, ModelTrainer trainer,
                           EnsembleAggregator aggregator, PredictionLedger ledger,
                           PeriodSynchronizer synchronizer, ResolutionService resolutionService,
                           Scheduler forecastCycleScheduler,
                           @Value("${forecast.min-records:100}") int minRecords) {
        this.context           = context;
        this.drawFeed          = drawFeed;
        this.trainer           = trainer;
        this.aggregator        = aggregator;
        this.ledger            = ledger;
        this.synchronizer      = synchronizer;
        this.resolutionService = resolutionService;
        this.cycleScheduler    = forecastCycleScheduler;
        this.minRecords        = minRecords;
    }

    /**
     * Forecast for the period after the newest buffered draw. A period that already has a
     * recorded decision returns that decision unchanged.
     */
    public Mono<ForecastResult> next() {
        return drawFeed.fetchLatest()
            .publishOn(cycleScheduler)
            .map(latest -> {
                ingest(latest, false);
                resolutionService.resolvePending();
                synchronizer.sync(latest);
                return forecastNextPeriod();
            });
    }

    /** Resolution pass: picks up freshly drawn outcomes for pending decisions. */
    public Mono<Integer> checkResults() {
        return drawFeed.fetchLatest()
            .publishOn(cycleScheduler)
            .map(latest -> {
                ingest(latest, false);
                int resolved = resolutionService.resolvePending();
                synchronizer.sync(latest);
                return resolved;
            });
    }

    /**
     * Continuous-learning pass: always retrains, even when the feed brought nothing new.
     *
     * @return number of newly ingested records
     */
    public Mono<Integer> learn() {
        return drawFeed.fetchLatest()
            .publishOn(cycleScheduler)
            .map(latest -> ingest(latest, true));
    }

    public ForecastStatsDTO stats() {
        LedgerTotals totals = ledger.totals();
        RunStreak.Snapshot streak = context.runStreak().snapshot();
        return new ForecastStatsDTO(
            totals.totalPredictions(),
            totals.wins(),
            totals.losses(),
            totals.winRate(),
            totals.pending(),
            streak.consecutiveWins(),
            streak.consecutiveLosses(),
            context.buffer().size(),
            trainer.completedPasses(),
            context.trainedModels().trainedAt(),
            trainer.lastSuccess(),
            context.marketState(),
            context.weightAdapter().weightsSnapshot(),
            context.weightAdapter().performanceSnapshot());
    }

    public List<TrackedPrediction> history(int limit) {
        return ledger.history(limit);
    }

    public boolean isReady() {
        return context.buffer().size() >= minRecords;
    }

    // ── cycle steps (forecast-cycle thread) ───────────────────────────────────

    private int ingest(List<OutcomeRecord> latest, boolean alwaysTrain) {
        int inserted = context.buffer().ingest(latest);
        if (inserted > 0) {
            log.info("Buffer updated. newRecords={} bufferSize={}", inserted, context.buffer().size());
        }
        if (inserted > 0 || alwaysTrain) {
            trainer.run();
        }
        return inserted;
    }

    private ForecastResult forecastNextPeriod() {
        int buffered = context.buffer().size();
        if (buffered < minRecords) {
            log.info("Not enough data to forecast. bufferSize={} required={}", buffered, minRecords);
            return ForecastResult.notReady(buffered, minRecords);
        }

        String targetPeriod = PeriodSequence.next(context.buffer().records().get(0).periodId());
        if (ledger.hasPredicted(targetPeriod)) {
            Optional<TrackedPrediction> existing = ledger.find(targetPeriod);
            if (existing.isPresent()) {
                log.info("Returning recorded forecast. period={}", targetPeriod);
                return ForecastResult.ready(existing.get().getDecision(), buffered, minRecords);
            }
        }

        EnsembleDecision decision = aggregator.predict().forPeriod(targetPeriod);
        ledger.record(decision);
        return ForecastResult.ready(decision, buffered, minRecords);
    }
}
