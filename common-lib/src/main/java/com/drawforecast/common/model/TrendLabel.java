package com.drawforecast.common.model;

/**
 * Short-horizon direction derived from the ten most recent bits.
 *
 * <pre>
 *   BIG count ≥ 7 → STRONG_BIG
 *   BIG count ≥ 6 → BIAS_BIG
 *   BIG count ≤ 3 → STRONG_SMALL
 *   BIG count ≤ 4 → BIAS_SMALL
 *   otherwise     → NEUTRAL
 * </pre>
 * Evaluated top-down, first match wins.
 */
public enum TrendLabel {
    STRONG_BIG,
    BIAS_BIG,
    NEUTRAL,
    BIAS_SMALL,
    STRONG_SMALL;

    public static TrendLabel fromBigCount(int bigCount) {
        if (bigCount >= 7) return STRONG_BIG;
        if (bigCount >= 6) return BIAS_BIG;
        if (bigCount <= 3) return STRONG_SMALL;
        if (bigCount <= 4) return BIAS_SMALL;
        return NEUTRAL;
    }

    public boolean isStrong() {
        return this == STRONG_BIG || this == STRONG_SMALL;
    }
}
