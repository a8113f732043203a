package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.CostRow;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.GroupSeries;
import com.costwatch.anomaly.model.GroupingDimensions;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs every registered detector over every group series and returns the ranked
 * findings. Groups are independent, so each series is one task on the detection
 * pool; ranking starts only once every task has completed.
 */
@Component
public class AnomalyDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final SeriesBuilder seriesBuilder;
    private final List<SeriesAnomalyDetector> detectors;
    private final ExecutorService executor;

    @Autowired
    public AnomalyDetectionEngine(SeriesBuilder seriesBuilder,
                                  List<SeriesAnomalyDetector> detectors,
                                  @Qualifier("detectionExecutor") ExecutorService executor) {
        if (detectors == null || detectors.isEmpty()) {
            throw new IllegalArgumentException("at least one detector is required");
        }
        this.seriesBuilder = seriesBuilder;
        this.detectors = List.copyOf(detectors);
        this.executor = executor;
    }

    /**
     * Single-threaded engine; every group is evaluated on the caller's thread.
     */
    public static AnomalyDetectionEngine sequential() {
        return new AnomalyDetectionEngine(new SeriesBuilder(),
                List.of(new PointAnomalyDetector(), new TrendAnomalyDetector()), null);
    }

    public List<Anomaly> detect(List<CostRow> rows, GroupingDimensions grouping, LocalDate referenceDate, DetectionSettings settings) {
        Objects.requireNonNull(grouping, "grouping must be provided");
        Objects.requireNonNull(referenceDate, "referenceDate must be provided");
        Objects.requireNonNull(settings, "settings must be provided");
        List<GroupSeries> series = seriesBuilder.build(rows, grouping, referenceDate, settings.windowDays());
        return detectSeries(series, grouping, settings);
    }

    public List<Anomaly> detectSeries(List<GroupSeries> series, GroupingDimensions grouping, DetectionSettings settings) {
        if (series.isEmpty()) {
            log.debug("Anomaly detection ({}): no series in window", grouping.label());
            return List.of();
        }
        long started = System.nanoTime();
        List<Anomaly> findings = runsInline(series.size())
                ? evaluateInline(series, grouping, settings)
                : evaluateConcurrently(series, grouping, settings);
        List<Anomaly> ranked = AnomalyRanking.rank(findings);
        log.debug("Anomaly detection ({}): {} series, {} findings in {} ms",
                grouping.label(), series.size(), ranked.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return ranked;
    }

    // parallelism 1 evaluates on the caller thread
    private boolean runsInline(int seriesCount) {
        return executor == null
                || seriesCount == 1
                || (executor instanceof ThreadPoolExecutor pool && pool.getMaximumPoolSize() == 1);
    }

    private List<Anomaly> evaluateInline(List<GroupSeries> series, GroupingDimensions grouping, DetectionSettings settings) {
        List<Anomaly> findings = new ArrayList<>();
        for (GroupSeries group : series) {
            findings.addAll(evaluate(group, grouping, settings));
        }
        return findings;
    }

    private List<Anomaly> evaluateConcurrently(List<GroupSeries> series, GroupingDimensions grouping, DetectionSettings settings) {
        List<Future<List<Anomaly>>> futures = new ArrayList<>(series.size());
        for (GroupSeries group : series) {
            futures.add(executor.submit(() -> evaluate(group, grouping, settings)));
        }
        List<Anomaly> findings = new ArrayList<>();
        try {
            for (Future<List<Anomaly>> future : futures) {
                findings.addAll(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for anomaly detection tasks", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Anomaly detection task failed", cause);
        }
        return findings;
    }

    private List<Anomaly> evaluate(GroupSeries series, GroupingDimensions grouping, DetectionSettings settings) {
        List<Anomaly> findings = new ArrayList<>(detectors.size());
        for (SeriesAnomalyDetector detector : detectors) {
            detector.detect(series, grouping, settings).ifPresent(findings::add);
        }
        return findings;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
