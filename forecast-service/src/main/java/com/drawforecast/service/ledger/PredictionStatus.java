package com.drawforecast.service.ledger;

public enum PredictionStatus {
    PENDING,
    WIN,
    LOSS
}
