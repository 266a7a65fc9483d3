package com.drawforecast.common.training;

import java.time.Instant;

/**
 * One generation of trained model state. Published as a whole by {@link ModelTrainer};
 * predictors never observe a half-rebuilt generation.
 */
public record TrainedModels(
    OccurrenceTable patterns,
    OccurrenceTable markovChains,
    TrendWindows trendWindows,
    Instant trainedAt
) {
    public static TrainedModels empty() {
        return new TrainedModels(OccurrenceTable.empty(), OccurrenceTable.empty(), TrendWindows.empty(), Instant.EPOCH);
    }
}
