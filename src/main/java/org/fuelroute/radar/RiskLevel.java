package org.fuelroute.radar;

/**
 * Classification of a gap between two refueling checkpoints.
 */
public enum RiskLevel {
    SAFE,
    ATTENTION,
    CRITICAL,
    /**
     * No range configured; the gap is reported without classification.
     */
    INFORMATIONAL;

    public static final double ATTENTION_RATIO = 0.8d;
    public static final double CRITICAL_RATIO = 1.0d;

    public static RiskLevel forRatio(double gapToRangeRatio) {
        if (gapToRangeRatio >= CRITICAL_RATIO) {
            return CRITICAL;
        }
        if (gapToRangeRatio >= ATTENTION_RATIO) {
            return ATTENTION;
        }
        return SAFE;
    }
}
