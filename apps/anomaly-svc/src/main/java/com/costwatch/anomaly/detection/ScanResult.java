package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.Anomaly;
import java.time.LocalDate;
import java.util.List;

public record ScanResult(
        LocalDate scanStart,
        LocalDate scanEnd,
        List<Anomaly> anomalies,
        int daysScanned
) {
    public ScanResult {
        anomalies = List.copyOf(anomalies);
    }
}
