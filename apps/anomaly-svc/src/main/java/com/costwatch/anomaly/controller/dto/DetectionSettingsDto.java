package com.costwatch.anomaly.controller.dto;

public record DetectionSettingsDto(
        int windowDays,
        String sensitivity,
        double zScoreThreshold,
        double minDailyCost,
        double driftThresholdPct,
        String dataSource
) {
}
