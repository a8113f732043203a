package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.GroupSeries;
import com.costwatch.anomaly.model.GroupingDimensions;
import java.util.Optional;

/**
 * Evaluates a single group's series in isolation. Implementations keep no state
 * between calls and may be invoked concurrently for different groups.
 */
@FunctionalInterface
public interface SeriesAnomalyDetector {

    /**
     * @return the finding for this series, or empty when the series is too short, below
     *         the cost floor, or simply unremarkable
     */
    Optional<Anomaly> detect(GroupSeries series, GroupingDimensions grouping, DetectionSettings settings);
}
