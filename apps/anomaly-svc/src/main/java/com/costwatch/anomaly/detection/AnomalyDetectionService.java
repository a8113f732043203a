package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.config.CostwatchProperties;
import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.CostRow;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.GroupingDimensions;
import com.costwatch.anomaly.model.Sensitivity;
import com.costwatch.anomaly.repository.DailyCostRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DailyCostRepository repository;
    private final AnomalyDetectionEngine engine;
    private final CostwatchProperties properties;
    private final Clock clock;

    public AnomalyDetectionService(DailyCostRepository repository,
                                   AnomalyDetectionEngine engine,
                                   CostwatchProperties properties,
                                   Clock clock) {
        this.repository = repository;
        this.engine = engine;
        this.properties = properties;
        this.clock = clock;
    }

    public DetectionSettings defaultSettings() {
        return properties.anomaly().toSettings();
    }

    /**
     * Settings for a request, falling back to the configured default for every value
     * the caller leaves {@code null}.
     */
    public DetectionSettings settingsFor(Integer windowDays, Sensitivity sensitivity, Double minDailyCost, Double driftThresholdPct) {
        CostwatchProperties.Anomaly defaults = properties.anomaly();
        return new DetectionSettings(
                windowDays != null ? windowDays : defaults.rollingWindowDays(),
                sensitivity != null ? sensitivity.zScoreThreshold() : defaults.zScoreThreshold(),
                minDailyCost != null ? minDailyCost : defaults.minDailyCost(),
                driftThresholdPct != null ? driftThresholdPct : defaults.driftThresholdPct());
    }

    public DetectionQuery defaultQuery() {
        return DetectionQuery.of(GroupingDimensions.SERVICE, defaultSettings());
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate referenceDateOf(DetectionQuery query) {
        return query.referenceDate().orElseGet(this::today);
    }

    public List<Anomaly> detect(DetectionQuery query) {
        LocalDate referenceDate = referenceDateOf(query);
        DetectionSettings settings = query.settings();
        LocalDate windowStart = SeriesBuilder.windowStart(referenceDate, settings.windowDays());
        List<CostRow> rows = repository.findDailyCosts(windowStart, referenceDate, query.dataSource());
        List<Anomaly> anomalies = engine.detect(rows, query.grouping(), referenceDate, settings);
        log.info("Anomaly detection: groupBy={}, window={}..{}, rows={}, anomalies={}",
                query.grouping().label(), windowStart, referenceDate, rows.size(), anomalies.size());
        return anomalies;
    }
}
