package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.Anomaly.Severity;

/**
 * Severity bands. Z-scores and drift percentages live on different scales, so each
 * kind has its own bands; band edges are exclusive.
 */
public final class SeverityClassifier {

    static final double POINT_CRITICAL_Z = 4.0d;
    static final double POINT_WARNING_Z = 3.0d;
    static final double TREND_CRITICAL_PERCENT = 100.0d;
    static final double TREND_WARNING_PERCENT = 50.0d;

    private SeverityClassifier() {
    }

    public static Severity forZScore(double zScore) {
        return band(Math.abs(zScore), POINT_CRITICAL_Z, POINT_WARNING_Z);
    }

    public static Severity forDriftPercent(double driftPercent) {
        return band(Math.abs(driftPercent), TREND_CRITICAL_PERCENT, TREND_WARNING_PERCENT);
    }

    private static Severity band(double magnitude, double critical, double warning) {
        if (magnitude > critical) {
            return Severity.CRITICAL;
        }
        if (magnitude > warning) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }
}
