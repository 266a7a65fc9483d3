package com.drawforecast.service.sync;

import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.period.PeriodSequence;
import com.drawforecast.service.ledger.PredictionLedger;
import com.drawforecast.service.ledger.PredictionStatus;
import com.drawforecast.service.ledger.TrackedPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Detects a desynchronised period sequence.
 *
 * <p>After resolution, the only pending decision that can still come true is the one for
 * {@code next(newest feed period)}. When the newest ledger entry is pending for any other
 * period (a missed draw, a feed gap, a clock jump) all pending entries are discarded and
 * the de-duplication set is cleared, so the next request predicts afresh.
 */
@Component
public class PeriodSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(PeriodSynchronizer.class);

    private final PredictionLedger ledger;

    public PeriodSynchronizer(PredictionLedger ledger) {
        this.ledger = ledger;
    }

    /**
     * @param latest records of the most recent feed fetch, any order
     * @return {@code true} when a desync was detected and pending entries were discarded
     */
    public boolean sync(List<OutcomeRecord> latest) {
        if (latest.isEmpty()) {
            return false;
        }
        String newestPeriod = latest.stream()
            .map(OutcomeRecord::periodId)
            .max(PeriodSequence::compare)
            .orElseThrow();
        String expectedNext = PeriodSequence.next(newestPeriod);

        Optional<TrackedPrediction> newest = ledger.newest();
        if (newest.isEmpty()
                || newest.get().getStatus() != PredictionStatus.PENDING
                || expectedNext.equals(newest.get().getPeriod())) {
            return false;
        }

        int discarded = ledger.discardPending();
        log.warn("Period mismatch, discarding pending predictions. expected={} lastPredicted={} discarded={}",
                 expectedNext, newest.get().getPeriod(), discarded);
        return true;
    }
}
