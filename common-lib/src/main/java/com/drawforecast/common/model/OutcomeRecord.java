package com.drawforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One resolved draw from the feed. Immutable; {@code periodId} is the uniqueness key.
 *
 * <p>{@code label} and {@code bit} are always derived from {@code digit}; use
 * {@link #of(String, int, Instant)} rather than the canonical constructor.
 */
public record OutcomeRecord(
    @JsonProperty("periodId")   String periodId,
    @JsonProperty("digit")      int digit,
    @JsonProperty("label")      OutcomeLabel label,
    @JsonProperty("bit")        int bit,
    @JsonProperty("observedAt") Instant observedAt
) {
    public OutcomeRecord {
        if (periodId == null || periodId.isBlank()) {
            throw new IllegalArgumentException("periodId must not be blank");
        }
        if (digit < 0 || digit > 9) {
            throw new IllegalArgumentException("digit out of range 0-9: " + digit + " (period " + periodId + ")");
        }
        if (label != OutcomeLabel.fromDigit(digit) || bit != OutcomeLabel.bitOf(digit)) {
            throw new IllegalArgumentException("label/bit inconsistent with digit " + digit + " (period " + periodId + ")");
        }
    }

    public static OutcomeRecord of(String periodId, int digit, Instant observedAt) {
        return new OutcomeRecord(periodId, digit, OutcomeLabel.fromDigit(digit), OutcomeLabel.bitOf(digit), observedAt);
    }

    public boolean isBig() {
        return label == OutcomeLabel.BIG;
    }
}
