package com.costwatch.anomaly.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record ScanResponseDto(
        LocalDate scanStart,
        LocalDate scanEnd,
        int daysScanned,
        String groupBy,
        DetectionSettingsDto settings,
        int anomalyCount,
        List<AnomalyResponseDto> anomalies,
        String traceId
) {
}
