package com.drawforecast.common.resolution;

import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.model.EnsembleDecision;
import com.drawforecast.common.model.OutcomeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes the learning loop for one decision: compares it with the drawn outcome, moves the
 * {@link com.drawforecast.common.model.RunStreak} and feeds every member's correctness to the
 * {@link com.drawforecast.common.adaptation.WeightAdapter}.
 */
public class OutcomeResolver {

    private static final Logger log = LoggerFactory.getLogger(OutcomeResolver.class);

    private final ForecastContext context;

    public OutcomeResolver(ForecastContext context) {
        this.context = context;
    }

    public ResolutionOutcome resolve(EnsembleDecision decision, OutcomeRecord actual) {
        if (decision.period() != null && !decision.period().equals(actual.periodId())) {
            throw new IllegalArgumentException("decision for period " + decision.period()
                + " cannot be resolved with period " + actual.periodId());
        }
        boolean win = decision.prediction() == actual.label();
        if (win) {
            context.runStreak().recordWin();
        } else {
            context.runStreak().recordLoss();
        }
        int updated = context.weightAdapter().recordAll(decision, actual.label());

        log.info("Decision resolved. period={} predicted={} actual={} digit={} result={}",
                 actual.periodId(), decision.prediction(), actual.label(), actual.digit(), win ? "WIN" : "LOSS");
        return new ResolutionOutcome(actual.periodId(), decision.prediction(), actual.label(),
            actual.digit(), win, updated);
    }
}
