package com.costwatch.anomaly.model;

import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * A single finding of one detection run.
 *
 * @param key       the group the finding belongs to
 * @param grouping  the grouping the key was projected through
 * @param kind      point (single day) or trend (whole window)
 * @param date      the flagged day for a point finding, the last observed day of the window for a trend
 * @param metric    modified z-score (point) or drift percentage (trend, {@code 87.5} means 87.5%)
 * @param direction spike/drop for points, drift up/down for trends
 * @param severity  severity band for the metric, scaled per kind
 * @param baseline  summary statistics the decision was made from
 */
public record Anomaly(
        GroupKey key,
        GroupingDimensions grouping,
        Kind kind,
        LocalDate date,
        double metric,
        Direction direction,
        Severity severity,
        Baseline baseline
) {

    public double magnitude() {
        return Math.abs(metric);
    }

    /**
     * First day a consumer should present for the finding: the flagged day itself for
     * point findings, the first observed day of the window for trends.
     */
    public LocalDate windowStart() {
        return kind == Kind.POINT ? date : baseline.firstDate();
    }

    public enum Kind {
        POINT,
        TREND
    }

    public enum Direction {
        SPIKE,
        DROP,
        DRIFT_UP,
        DRIFT_DOWN
    }

    public enum Severity {
        CRITICAL,
        WARNING,
        INFO
    }

    /**
     * @param currentCost  cost of the last day in the series
     * @param median       baseline median (point) or whole series median (trend)
     * @param mad          median absolute deviation around {@code median}
     * @param observations number of daily points the statistics were computed from
     * @param firstDate    first day of the evaluated span
     * @param slope        Theil-Sen slope in cost per day, trend findings only
     */
    public record Baseline(
            double currentCost,
            double median,
            double mad,
            int observations,
            LocalDate firstDate,
            OptionalDouble slope
    ) {
    }
}
