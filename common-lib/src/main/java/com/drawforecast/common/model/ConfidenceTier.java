package com.drawforecast.common.model;

/**
 * Confidence tier of an ensemble decision.
 *
 * <pre>
 *   ULTRA_HIGH : confidence ≥ 78 % and agreement ≥ 0.8
 *   HIGH       : confidence ≥ 70 % and agreement ≥ 0.7
 *   MEDIUM     : confidence ≥ 63 % and agreement ≥ 0.6
 *   LOW        : confidence ≥ 55 %
 *   VERY_LOW   : otherwise
 * </pre>
 */
public enum ConfidenceTier {

    ULTRA_HIGH(78.0, 0.8, "MAX CONFIDENCE"),
    HIGH(70.0, 0.7, "HIGH CONFIDENCE"),
    MEDIUM(63.0, 0.6, "MEDIUM CONFIDENCE"),
    LOW(55.0, 0.0, "LOW CONFIDENCE"),
    VERY_LOW(Double.NEGATIVE_INFINITY, 0.0, "VERY LOW - PROCEED WITH CAUTION");

    private final double minConfidencePercent;
    private final double minAgreement;
    private final String recommendation;

    ConfidenceTier(double minConfidencePercent, double minAgreement, String recommendation) {
        this.minConfidencePercent = minConfidencePercent;
        this.minAgreement         = minAgreement;
        this.recommendation       = recommendation;
    }

    public String recommendation() {
        return recommendation;
    }

    /**
     * @param confidencePercent shaped ensemble confidence × 100 (unrounded)
     * @param agreement         fraction of models on the majority side, [0, 1]
     */
    public static ConfidenceTier classify(double confidencePercent, double agreement) {
        for (ConfidenceTier tier : values()) {
            if (confidencePercent >= tier.minConfidencePercent && agreement >= tier.minAgreement) {
                return tier;
            }
        }
        return VERY_LOW;
    }
}
