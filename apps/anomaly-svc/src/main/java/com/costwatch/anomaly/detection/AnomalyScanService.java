package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.CostRow;
import com.costwatch.anomaly.model.GroupKey;
import com.costwatch.anomaly.model.InvalidConfigurationException;
import com.costwatch.anomaly.repository.DailyCostRepository;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replays detection for every day of a historical range. A group that stays flagged
 * on consecutive days is reported once per streak, keeping the day with the
 * strongest metric.
 */
@Service
public class AnomalyScanService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyScanService.class);
    static final int MAX_SCAN_DAYS = 366;

    private final DailyCostRepository repository;
    private final AnomalyDetectionEngine engine;

    public AnomalyScanService(DailyCostRepository repository, AnomalyDetectionEngine engine) {
        this.repository = repository;
        this.engine = engine;
    }

    public ScanResult scan(LocalDate scanStart, LocalDate scanEnd, DetectionQuery query) {
        if (scanStart == null || scanEnd == null) {
            throw new InvalidConfigurationException("scan start and end dates must be provided");
        }
        if (scanStart.isAfter(scanEnd)) {
            throw new InvalidConfigurationException("scan start (" + scanStart + ") must be on or before scan end (" + scanEnd + ")");
        }
        long span = ChronoUnit.DAYS.between(scanStart, scanEnd) + 1;
        if (span > MAX_SCAN_DAYS) {
            throw new InvalidConfigurationException("scan range may cover at most " + MAX_SCAN_DAYS + " days, got " + span);
        }
        LocalDate loadFrom = SeriesBuilder.windowStart(scanStart, query.settings().windowDays());
        List<CostRow> rows = repository.findDailyCosts(loadFrom, scanEnd, query.dataSource());

        Map<StreakKey, Anomaly> active = new LinkedHashMap<>();
        List<Anomaly> finished = new ArrayList<>();
        int daysScanned = 0;
        for (LocalDate day = scanStart; !day.isAfter(scanEnd); day = day.plusDays(1)) {
            daysScanned++;
            List<Anomaly> dayFindings = engine.detect(rows, query.grouping(), day, query.settings());
            Set<StreakKey> seenToday = new HashSet<>();
            for (Anomaly anomaly : dayFindings) {
                StreakKey key = new StreakKey(anomaly.key(), anomaly.kind());
                seenToday.add(key);
                active.merge(key, anomaly, (previous, current) ->
                        current.magnitude() > previous.magnitude() ? current : previous);
            }
            var iterator = active.entrySet().iterator();
            while (iterator.hasNext()) {
                var entry = iterator.next();
                if (!seenToday.contains(entry.getKey())) {
                    finished.add(entry.getValue());
                    iterator.remove();
                }
            }
        }
        finished.addAll(active.values());

        List<Anomaly> ranked = AnomalyRanking.rank(finished);
        log.info("Anomaly scan: groupBy={}, range={}..{}, days={}, anomalies={}",
                query.grouping().label(), scanStart, scanEnd, daysScanned, ranked.size());
        return new ScanResult(scanStart, scanEnd, ranked, daysScanned);
    }

    private record StreakKey(GroupKey key, Anomaly.Kind kind) {
    }
}
