package com.costwatch.anomaly.model;

/**
 * Every tunable of a detection run, passed explicitly into each invocation.
 *
 * @param windowDays            trailing window length in calendar days, the reference day included
 * @param zScoreThreshold       minimum |modified z-score| for a point finding
 * @param minDailyCost          noise floor; also the minimum gap a flat baseline must move by
 * @param driftThresholdPercent minimum |drift| over the window for a trend finding, in percent
 */
public record DetectionSettings(
        int windowDays,
        double zScoreThreshold,
        double minDailyCost,
        double driftThresholdPercent
) {

    public static final int MIN_WINDOW_DAYS = 3;
    public static final double DEFAULT_DRIFT_THRESHOLD_PERCENT = 20.0d;

    public DetectionSettings {
        if (windowDays < MIN_WINDOW_DAYS) {
            throw new InvalidConfigurationException("window must cover at least " + MIN_WINDOW_DAYS + " days, got " + windowDays);
        }
        if (!(zScoreThreshold > 0)) {
            throw new InvalidConfigurationException("z-score threshold must be positive, got " + zScoreThreshold);
        }
        if (!(driftThresholdPercent > 0)) {
            throw new InvalidConfigurationException("drift threshold must be positive, got " + driftThresholdPercent);
        }
        if (!(minDailyCost >= 0) || Double.isInfinite(minDailyCost)) {
            throw new InvalidConfigurationException("minimum daily cost must be a non-negative amount, got " + minDailyCost);
        }
    }

    public static DetectionSettings of(int windowDays, Sensitivity sensitivity, double minDailyCost, double driftThresholdPercent) {
        return new DetectionSettings(windowDays, sensitivity.zScoreThreshold(), minDailyCost, driftThresholdPercent);
    }

    public DetectionSettings withZScoreThreshold(double threshold) {
        return new DetectionSettings(windowDays, threshold, minDailyCost, driftThresholdPercent);
    }
}
