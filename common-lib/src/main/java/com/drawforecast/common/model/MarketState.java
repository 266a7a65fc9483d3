package com.drawforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Regime descriptor recomputed wholesale on every training pass.
 *
 * <ul>
 *   <li>{@code volatility}        – std / (mean + ε) of the digit values</li>
 *   <li>{@code bias}              – fraction of BIG outcomes in the analysis window</li>
 *   <li>{@code entropy}           – base-2 Shannon entropy of the bit sequence ([0, 1])</li>
 *   <li>{@code recentTrend}       – {@link TrendLabel} of the ten newest bits</li>
 *   <li>{@code confidence}        – market-level confidence, clamp(1 − 2·|bias − 0.5|, 0.3, 0.9)</li>
 *   <li>{@code randomnessQuality} – 1 − entropy</li>
 *   <li>{@code exploitable}       – entropy &lt; 0.92 and |runs z| &gt; 1.96</li>
 *   <li>{@code runsZScore}        – Wald–Wolfowitz style z-score of the bit runs</li>
 *   <li>{@code spectralBias}      – share of consecutive digit jumps of 3 or more</li>
 * </ul>
 */
public record MarketState(
    @JsonProperty("volatility")        double volatility,
    @JsonProperty("bias")              double bias,
    @JsonProperty("entropy")           double entropy,
    @JsonProperty("recentTrend")       TrendLabel recentTrend,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("randomnessQuality") double randomnessQuality,
    @JsonProperty("exploitable")       boolean exploitable,
    @JsonProperty("runsZScore")        double runsZScore,
    @JsonProperty("spectralBias")      double spectralBias,
    @JsonProperty("lastUpdate")        Instant lastUpdate
) {
    /** State before the first successful analysis. */
    public static MarketState initial() {
        return new MarketState(0.0, 0.5, 0.0, TrendLabel.NEUTRAL, 0.5, 1.0, false, 0.0, 0.0, Instant.EPOCH);
    }
}
