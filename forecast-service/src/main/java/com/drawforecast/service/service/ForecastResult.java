package com.drawforecast.service.service;

import com.drawforecast.common.model.EnsembleDecision;

/**
 * Outcome of a forecast request: either a decision for the next period, or "not ready"
 * while the buffer is still below the configured minimum.
 */
public record ForecastResult(EnsembleDecision decision, int bufferedRecords, int requiredRecords) {

    public static ForecastResult ready(EnsembleDecision decision, int bufferedRecords, int requiredRecords) {
        return new ForecastResult(decision, bufferedRecords, requiredRecords);
    }

    public static ForecastResult notReady(int bufferedRecords, int requiredRecords) {
        return new ForecastResult(null, bufferedRecords, requiredRecords);
    }

    public boolean isReady() {
        return decision != null;
    }
}
