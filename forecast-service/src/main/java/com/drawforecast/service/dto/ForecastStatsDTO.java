package com.drawforecast.service.dto;

import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.ModelPerformance;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of the forecasting engine returned by {@code GET /api/v1/forecast/stats}.
 *
 * @param totalPredictions  decisions recorded since startup
 * @param wins              resolved decisions that matched the draw
 * @param losses            resolved decisions that missed
 * @param winRate           wins / (wins + losses), 0 before the first resolution
 * @param pending           decisions still waiting for their draw
 * @param consecutiveWins   current win streak
 * @param consecutiveLosses current loss streak
 * @param bufferSize        draws currently buffered
 * @param trainingPasses    successful training passes since startup
 * @param lastTrainedAt     time of the current trained generation
 * @param lastTrainingSuccess wall-clock time of the last successful training pass, epoch before the first
 * @param marketState       current market state
 * @param weights           current ensemble weights
 * @param modelPerformance  rolling accuracy per model
 */
public record ForecastStatsDTO(
    long   totalPredictions,
    long   wins,
    long   losses,
    double winRate,
    int    pending,
    int    consecutiveWins,
    int    consecutiveLosses,
    int    bufferSize,
    long   trainingPasses,
    Instant lastTrainedAt,
    Instant lastTrainingSuccess,
    MarketState marketState,
    Map<String, Double> weights,
    Map<String, ModelPerformance> modelPerformance
) {}
