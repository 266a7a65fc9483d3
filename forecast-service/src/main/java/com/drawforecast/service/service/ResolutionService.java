package com.drawforecast.service.service;

import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.resolution.OutcomeResolver;
import com.drawforecast.common.resolution.ResolutionOutcome;
import com.drawforecast.common.training.ModelTrainer;
import com.drawforecast.service.ledger.PredictionLedger;
import com.drawforecast.service.ledger.TrackedPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves pending ledger entries whose period has been drawn and triggers a retrain after
 * every {@code forecast.training.retrain-after-resolutions} resolutions.
 *
 * <p>Runs on the forecast cycle thread only; the resolution counter is not shared.
 */
@Service
public class ResolutionService {

    private static final Logger log = LoggerFactory.getLogger(ResolutionService.class);

    private final ForecastContext context;
    private final OutcomeResolver resolver;
    private final ModelTrainer trainer;
    private final PredictionLedger ledger;
    private final int retrainAfter;

    private int resolvedSinceRetrain;

    public ResolutionService(ForecastContext context, OutcomeResolver resolver, ModelTrainer trainer,
                             PredictionLedger ledger,
                             @Value("${forecast.training.retrain-after-resolutions:10}") int retrainAfter) {
        this.context      = context;
        this.resolver     = resolver;
        this.trainer      = trainer;
        this.ledger       = ledger;
        this.retrainAfter = retrainAfter;
    }

    /**
     * @return number of entries resolved in this pass
     */
    public int resolvePending() {
        Map<String, OutcomeRecord> drawn = context.buffer().records().stream()
            .collect(Collectors.toMap(OutcomeRecord::periodId, Function.identity()));

        int resolved = 0;
        for (TrackedPrediction entry : ledger.pending()) {
            OutcomeRecord actual = drawn.get(entry.getPeriod());
            if (actual == null) {
                continue;
            }
            ResolutionOutcome outcome = resolver.resolve(entry.getDecision(), actual);
            ledger.markResolved(outcome);
            resolved++;
        }
        if (resolved == 0) {
            return 0;
        }

        resolvedSinceRetrain += resolved;
        log.info("Pending predictions resolved. resolved={} sinceRetrain={}", resolved, resolvedSinceRetrain);
        if (resolvedSinceRetrain >= retrainAfter) {
            resolvedSinceRetrain = 0;
            log.info("Retrain threshold reached. threshold={}", retrainAfter);
            trainer.run();
        }
        return resolved;
    }
}
