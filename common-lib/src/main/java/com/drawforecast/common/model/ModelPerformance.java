package com.drawforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rolling correctness of one ensemble member.
 *
 * <p>{@code recentAccuracy} is an exponentially weighted hit rate:
 * {@code acc ← acc × 0.9 + hit × 0.1}, starting at 0.5.
 */
public record ModelPerformance(
    @JsonProperty("wins")           long wins,
    @JsonProperty("total")          long total,
    @JsonProperty("recentAccuracy") double recentAccuracy
) {
    public static final double DECAY = 0.9;
    public static final double INITIAL_ACCURACY = 0.5;

    public static ModelPerformance initial() {
        return new ModelPerformance(0, 0, INITIAL_ACCURACY);
    }

    public ModelPerformance record(boolean correct) {
        double hit = correct ? 1.0 : 0.0;
        return new ModelPerformance(
            correct ? wins + 1 : wins,
            total + 1,
            recentAccuracy * DECAY + hit * (1.0 - DECAY));
    }
}
