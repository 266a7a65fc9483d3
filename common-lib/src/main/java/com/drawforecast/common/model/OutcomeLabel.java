package com.drawforecast.common.model;

/**
 * Binary label attached to every drawn digit: {@link #BIG} for 5–9, {@link #SMALL} for 0–4.
 */
public enum OutcomeLabel {

    BIG,
    SMALL;

    /** Digits at or above this value are BIG. */
    public static final int BIG_THRESHOLD = 5;

    public static OutcomeLabel fromDigit(int digit) {
        return digit >= BIG_THRESHOLD ? BIG : SMALL;
    }

    public static int bitOf(int digit) {
        return digit >= BIG_THRESHOLD ? 1 : 0;
    }

    public OutcomeLabel opposite() {
        return this == BIG ? SMALL : BIG;
    }
}
