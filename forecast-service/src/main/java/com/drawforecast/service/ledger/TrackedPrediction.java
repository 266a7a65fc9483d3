package com.drawforecast.service.ledger;

import com.drawforecast.common.model.ConfidenceTier;
import com.drawforecast.common.model.EnsembleDecision;
import com.drawforecast.common.model.OutcomeLabel;
import com.drawforecast.common.model.RecoveryMode;
import com.drawforecast.common.model.TrendLabel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger entry for one issued decision.
 *
 * Lifecycle:
 *   PENDING → WIN | LOSS   once the drawn outcome for {@code period} is known
 *   PENDING → (discarded)  when the period sequence desynchronises
 *
 * decision: the full ensemble decision; kept for outcome resolution, not serialised
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackedPrediction {

    private String id;

    private String period;

    private OutcomeLabel prediction;

    private int confidencePercent;

    private ConfidenceTier tier;

    private String recommendation;

    private int agreementPercent;

    private TrendLabel marketCondition;

    private RecoveryMode recoveryMode;

    private PredictionStatus status;

    private OutcomeLabel actual;

    private Integer actualDigit;

    private Instant createdAt;

    private Instant resolvedAt;

    @JsonIgnore
    private EnsembleDecision decision;
}
