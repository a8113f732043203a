package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.GroupingDimensions;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * A detection request against the cost store.
 *
 * @param referenceDate the "today" of the window; empty means today in UTC
 * @param dataSource    restricts rows to one ingestion source ({@code cur} or {@code cost_explorer})
 */
public record DetectionQuery(
        GroupingDimensions grouping,
        DetectionSettings settings,
        Optional<LocalDate> referenceDate,
        Optional<String> dataSource
) {

    public DetectionQuery {
        Objects.requireNonNull(grouping, "grouping must be provided");
        Objects.requireNonNull(settings, "settings must be provided");
        referenceDate = referenceDate == null ? Optional.empty() : referenceDate;
        dataSource = dataSource == null ? Optional.empty() : dataSource.filter(value -> !value.isBlank());
    }

    public static DetectionQuery of(GroupingDimensions grouping, DetectionSettings settings) {
        return new DetectionQuery(grouping, settings, Optional.empty(), Optional.empty());
    }
}
