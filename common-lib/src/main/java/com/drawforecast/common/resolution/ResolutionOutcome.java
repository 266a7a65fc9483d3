package com.drawforecast.common.resolution;

import com.drawforecast.common.model.OutcomeLabel;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ResolutionOutcome(
    @JsonProperty("period")           String period,
    @JsonProperty("predicted")        OutcomeLabel predicted,
    @JsonProperty("actual")           OutcomeLabel actual,
    @JsonProperty("actualDigit")      int actualDigit,
    @JsonProperty("win")              boolean win,
    @JsonProperty("modelsUpdated")    int modelsUpdated
) {}
