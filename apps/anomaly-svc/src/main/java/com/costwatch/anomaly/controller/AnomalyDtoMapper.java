package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.controller.dto.AnomalyResponseDto;
import com.costwatch.anomaly.controller.dto.DetectionSettingsDto;
import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.Sensitivity;
import java.util.List;
import java.util.Optional;

final class AnomalyDtoMapper {

    private AnomalyDtoMapper() {
    }

    static List<AnomalyResponseDto> map(List<Anomaly> anomalies) {
        return anomalies.stream().map(AnomalyDtoMapper::map).toList();
    }

    static AnomalyResponseDto map(Anomaly anomaly) {
        Anomaly.Baseline baseline = anomaly.baseline();
        return new AnomalyResponseDto(
                anomaly.kind().name(),
                anomaly.grouping().columnLabel(),
                anomaly.key().values(),
                anomaly.key().label(),
                anomaly.date(),
                anomaly.windowStart(),
                anomaly.date(),
                anomaly.metric(),
                anomaly.direction().name(),
                anomaly.severity().name(),
                new AnomalyResponseDto.Baseline(
                        baseline.currentCost(),
                        baseline.median(),
                        baseline.mad(),
                        baseline.observations(),
                        baseline.slope().isPresent() ? baseline.slope().getAsDouble() : null)
        );
    }

    static DetectionSettingsDto map(DetectionSettings settings, Optional<String> dataSource) {
        return new DetectionSettingsDto(
                settings.windowDays(),
                Sensitivity.forThreshold(settings.zScoreThreshold()).label(),
                settings.zScoreThreshold(),
                settings.minDailyCost(),
                settings.driftThresholdPercent(),
                dataSource.orElse(null)
        );
    }
}
