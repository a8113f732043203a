package com.costwatch.anomaly.controller.dto;

import java.time.LocalDate;
import java.util.List;

public record AnomalyListResponseDto(
        LocalDate referenceDate,
        String groupBy,
        DetectionSettingsDto settings,
        int anomalyCount,
        List<AnomalyResponseDto> anomalies,
        String traceId
) {
}
