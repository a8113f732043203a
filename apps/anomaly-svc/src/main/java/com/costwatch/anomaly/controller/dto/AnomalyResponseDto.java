package com.costwatch.anomaly.controller.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * One finding as rendered over HTTP. {@code windowStart}/{@code windowEnd} are the same
 * day for point findings and span the observed window for trends; {@code metric} is
 * the raw score (z-score or drift percentage) without rounding.
 */
public record AnomalyResponseDto(
        String kind,
        String groupBy,
        List<String> groupKey,
        String groupValue,
        LocalDate date,
        LocalDate windowStart,
        LocalDate windowEnd,
        double metric,
        String direction,
        String severity,
        Baseline baseline
) {
    public record Baseline(double currentCost, double median, double mad, int observations, Double slope) {
    }
}
