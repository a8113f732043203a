package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.GroupSeries;
import com.costwatch.anomaly.model.GroupingDimensions;
import java.util.Optional;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * Flags gradual drift across the whole window. The Theil-Sen slope is projected over
 * the number of observed days and expressed relative to the series median.
 */
@Component
public class TrendAnomalyDetector implements SeriesAnomalyDetector {

    static final int MIN_POINTS = 5;

    @Override
    public Optional<Anomaly> detect(GroupSeries series, GroupingDimensions grouping, DetectionSettings settings) {
        if (series.size() < MIN_POINTS) {
            return Optional.empty();
        }
        double[] costs = series.costs();
        double median = RobustStatistics.median(costs);
        // drift is relative to the median
        if (median <= 0) {
            return Optional.empty();
        }
        double slope = RobustStatistics.theilSenSlope(costs);
        double driftPercent = slope * costs.length / median * 100.0d;
        if (Math.abs(driftPercent) < settings.driftThresholdPercent()) {
            return Optional.empty();
        }
        return Optional.of(new Anomaly(
                series.key(),
                grouping,
                Anomaly.Kind.TREND,
                series.last().date(),
                driftPercent,
                driftPercent > 0 ? Anomaly.Direction.DRIFT_UP : Anomaly.Direction.DRIFT_DOWN,
                SeverityClassifier.forDriftPercent(driftPercent),
                new Anomaly.Baseline(
                        costs[costs.length - 1],
                        median,
                        RobustStatistics.mad(costs),
                        costs.length,
                        series.points().get(0).date(),
                        OptionalDouble.of(slope))
        ));
    }
}
