package com.drawforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of a single ensemble member.
 *
 * <p>{@code source} distinguishes a learned prediction ({@code "pattern"}, {@code "markov_order3"},
 * {@code "lstm"} …) from a fallback ({@code "pattern_fallback"}, {@code "lstm_insufficient"} …).
 */
public record ModelOutput(
    @JsonProperty("prediction") OutcomeLabel prediction,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("source")     String source
) {
    public static ModelOutput of(OutcomeLabel prediction, double confidence, String source) {
        return new ModelOutput(prediction, confidence, source);
    }

    /** Neutral BIG / 0.50 output used whenever a model has nothing to say. */
    public static ModelOutput neutral(String source) {
        return new ModelOutput(OutcomeLabel.BIG, 0.50, source);
    }
}
