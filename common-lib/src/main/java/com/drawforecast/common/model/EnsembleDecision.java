package com.drawforecast.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable output of one ensemble run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code period}:            draw period this decision targets; {@code null} until the
 *                                  caller binds it with {@link #forPeriod(String)}</li>
 *   <li>{@code prediction}:        final label after recovery mode</li>
 *   <li>{@code rawPrediction}:     weighted-vote label before recovery mode</li>
 *   <li>{@code confidence}:        shaped confidence in [0.50, 0.92]</li>
 *   <li>{@code confidencePercent}: {@code confidence} × 100, rounded</li>
 *   <li>{@code agreementPercent}:  share of models on the majority side × 100, rounded</li>
 *   <li>{@code modelOutputs}:      per-model outputs in ensemble order</li>
 *   <li>{@code weights}:           snapshot of the weights used for the vote</li>
 *   <li>{@code reasons}:           ordered reasoning trace, never empty</li>
 * </ul>
 */
@JsonIgnoreProperties(value = "reasoning", allowGetters = true)
public record EnsembleDecision(
    @JsonProperty("period")            String period,
    @JsonProperty("prediction")        OutcomeLabel prediction,
    @JsonProperty("rawPrediction")     OutcomeLabel rawPrediction,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("confidencePercent") int confidencePercent,
    @JsonProperty("tier")              ConfidenceTier tier,
    @JsonProperty("recommendation")    String recommendation,
    @JsonProperty("agreementPercent")  int agreementPercent,
    @JsonProperty("marketCondition")   TrendLabel marketCondition,
    @JsonProperty("recoveryMode")      RecoveryMode recoveryMode,
    @JsonProperty("modelOutputs")      Map<String, ModelOutput> modelOutputs,
    @JsonProperty("weights")           Map<String, Double> weights,
    @JsonProperty("reasons")           List<String> reasons
) {
    public EnsembleDecision {
        modelOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(modelOutputs));
        weights      = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        reasons      = List.copyOf(reasons);
    }

    /** Human-readable reasoning, e.g. {@code "Strong model consensus; Recovery mode: CAUTION."} */
    @JsonProperty("reasoning")
    public String reasoning() {
        return String.join("; ", reasons) + ".";
    }

    public EnsembleDecision forPeriod(String targetPeriod) {
        return new EnsembleDecision(targetPeriod, prediction, rawPrediction, confidence, confidencePercent,
            tier, recommendation, agreementPercent, marketCondition, recoveryMode,
            modelOutputs, weights, reasons);
    }
}
