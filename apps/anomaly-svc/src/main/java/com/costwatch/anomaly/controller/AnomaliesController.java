package com.costwatch.anomaly.controller;

import com.costwatch.anomaly.controller.dto.AnomalyListResponseDto;
import com.costwatch.anomaly.controller.dto.ScanResponseDto;
import com.costwatch.anomaly.detection.AnomalyDetectionService;
import com.costwatch.anomaly.detection.AnomalyScanService;
import com.costwatch.anomaly.detection.DetectionQuery;
import com.costwatch.anomaly.detection.ScanResult;
import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.GroupingDimensions;
import com.costwatch.anomaly.model.Sensitivity;
import com.costwatch.anomaly.web.RequestContextHolder;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AnomaliesController {

    private final AnomalyDetectionService detectionService;
    private final AnomalyScanService scanService;

    public AnomaliesController(AnomalyDetectionService detectionService, AnomalyScanService scanService) {
        this.detectionService = detectionService;
        this.scanService = scanService;
    }

    @GetMapping
    public ResponseEntity<AnomalyListResponseDto> detect(
            @RequestParam(value = "days", required = false) Integer days,
            @RequestParam(value = "sensitivity", required = false) String sensitivity,
            @RequestParam(value = "groupBy", required = false, defaultValue = "service") String groupBy,
            @RequestParam(value = "driftThreshold", required = false) Double driftThreshold,
            @RequestParam(value = "minDailyCost", required = false) Double minDailyCost,
            @RequestParam(value = "referenceDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate referenceDate,
            @RequestParam(value = "dataSource", required = false) String dataSource
    ) {
        DetectionQuery query = query(days, sensitivity, groupBy, driftThreshold, minDailyCost, referenceDate, dataSource);
        List<Anomaly> anomalies = detectionService.detect(query);
        return ResponseEntity.ok(new AnomalyListResponseDto(
                detectionService.referenceDateOf(query),
                query.grouping().columnLabel(),
                AnomalyDtoMapper.map(query.settings(), query.dataSource()),
                anomalies.size(),
                AnomalyDtoMapper.map(anomalies),
                RequestContextHolder.currentTraceId().orElse(null)
        ));
    }

    @GetMapping("/scan")
    public ResponseEntity<ScanResponseDto> scan(
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(value = "days", required = false) Integer days,
            @RequestParam(value = "sensitivity", required = false) String sensitivity,
            @RequestParam(value = "groupBy", required = false, defaultValue = "service") String groupBy,
            @RequestParam(value = "driftThreshold", required = false) Double driftThreshold,
            @RequestParam(value = "minDailyCost", required = false) Double minDailyCost,
            @RequestParam(value = "dataSource", required = false) String dataSource
    ) {
        DetectionQuery query = query(days, sensitivity, groupBy, driftThreshold, minDailyCost, null, dataSource);
        ScanResult result = scanService.scan(start, end, query);
        return ResponseEntity.ok(new ScanResponseDto(
                result.scanStart(),
                result.scanEnd(),
                result.daysScanned(),
                query.grouping().columnLabel(),
                AnomalyDtoMapper.map(query.settings(), query.dataSource()),
                result.anomalies().size(),
                AnomalyDtoMapper.map(result.anomalies()),
                RequestContextHolder.currentTraceId().orElse(null)
        ));
    }

    private DetectionQuery query(Integer days, String sensitivity, String groupBy, Double driftThreshold,
                                 Double minDailyCost, LocalDate referenceDate, String dataSource) {
        GroupingDimensions grouping = GroupingDimensions.fromLabel(groupBy);
        Sensitivity level = sensitivity == null || sensitivity.isBlank() ? null : Sensitivity.fromLabel(sensitivity);
        DetectionSettings settings = detectionService.settingsFor(days, level, minDailyCost, driftThreshold);
        return new DetectionQuery(grouping, settings, Optional.ofNullable(referenceDate), Optional.ofNullable(dataSource));
    }
}
