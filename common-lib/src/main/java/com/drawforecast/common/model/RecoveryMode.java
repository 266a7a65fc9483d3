package com.drawforecast.common.model;

/**
 * Loss-streak handling applied by the ensemble. Only {@link #ANTI_TREND} changes the
 * predicted label; the other modes are advisory.
 */
public enum RecoveryMode {
    NORMAL,
    MARTINGALE_SAFE,
    CAUTION,
    ANTI_TREND;

    public OutcomeLabel apply(OutcomeLabel rawLabel) {
        return this == ANTI_TREND ? rawLabel.opposite() : rawLabel;
    }
}
