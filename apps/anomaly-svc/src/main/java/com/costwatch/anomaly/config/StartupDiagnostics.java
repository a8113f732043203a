package com.costwatch.anomaly.config;

import com.costwatch.anomaly.model.Sensitivity;
import com.costwatch.anomaly.repository.DailyCostRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final CostwatchProperties props;
    private final DailyCostRepository repository;

    public StartupDiagnostics(CostwatchProperties props, DailyCostRepository repository) {
        this.props = props;
        this.repository = repository;
    }

    @PostConstruct
    void logConfig() {
        var anomaly = props.anomaly();
        log.info("Anomaly config: window={}d, zThreshold={} (sensitivity={}), minDailyCost={}, driftThreshold={}%, parallelism={}",
                anomaly.rollingWindowDays(), anomaly.zScoreThreshold(),
                Sensitivity.forThreshold(anomaly.zScoreThreshold()).label(),
                anomaly.minDailyCost(), anomaly.driftThresholdPct(), anomaly.parallelism());
        log.info("Cost store: configured='{}', active='{}'", props.store().type(), repository.storeType());
        if ("memory".equals(repository.storeType()) && !repository.hasData()) {
            log.warn("Cost store is in-memory and empty: detection returns no findings until rows are loaded. "
                    + "Set costwatch.store.type=jdbc to read daily_cost_summary.");
        }
    }
}
