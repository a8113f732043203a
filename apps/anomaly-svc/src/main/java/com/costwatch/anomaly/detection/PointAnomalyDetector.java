package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.DailyCostPoint;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.GroupSeries;
import com.costwatch.anomaly.model.GroupingDimensions;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * Flags the most recent day when it sits far from the median of the preceding days,
 * measured with the modified z-score {@code 0.6745 * (x - median) / MAD}.
 */
@Component
public class PointAnomalyDetector implements SeriesAnomalyDetector {

    static final int MIN_POINTS = 3;
    static final double MAD_SCALE = 0.6745d;
    static final double FLAT_BASELINE_Z = 10.0d;
    // MAD below this is treated as a perfectly flat baseline
    private static final double FLAT_MAD_EPSILON = 1e-10d;

    @Override
    public Optional<Anomaly> detect(GroupSeries series, GroupingDimensions grouping, DetectionSettings settings) {
        if (series.size() < MIN_POINTS) {
            return Optional.empty();
        }
        double[] costs = series.costs();
        double current = costs[costs.length - 1];
        if (current < settings.minDailyCost()) {
            return Optional.empty();
        }
        double[] baseline = Arrays.copyOf(costs, costs.length - 1);
        double median = RobustStatistics.median(baseline);
        double mad = RobustStatistics.mad(baseline);

        double zScore;
        if (mad < FLAT_MAD_EPSILON) {
            if (current - median > settings.minDailyCost()) {
                zScore = FLAT_BASELINE_Z;
            } else if (median - current > settings.minDailyCost()) {
                zScore = -FLAT_BASELINE_Z;
            } else {
                return Optional.empty();
            }
        } else {
            zScore = MAD_SCALE * (current - median) / mad;
        }

        if (Math.abs(zScore) < settings.zScoreThreshold()) {
            return Optional.empty();
        }
        DailyCostPoint flagged = series.last();
        return Optional.of(new Anomaly(
                series.key(),
                grouping,
                Anomaly.Kind.POINT,
                flagged.date(),
                zScore,
                zScore > 0 ? Anomaly.Direction.SPIKE : Anomaly.Direction.DROP,
                SeverityClassifier.forZScore(zScore),
                new Anomaly.Baseline(current, median, mad, baseline.length, series.points().get(0).date(), OptionalDouble.empty())
        ));
    }
}
