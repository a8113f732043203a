package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.CostRow;
import com.costwatch.anomaly.model.DailyCostPoint;
import com.costwatch.anomaly.model.GroupKey;
import com.costwatch.anomaly.model.GroupSeries;
import com.costwatch.anomaly.model.GroupingDimensions;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Partitions store rows into one chronological series per group key. Rows of the
 * same key and day (several accounts under one service, say) are summed; days
 * without rows stay absent rather than becoming zero-cost days.
 */
@Component
public class SeriesBuilder {

    public List<GroupSeries> build(List<CostRow> rows, GroupingDimensions grouping, LocalDate referenceDate, int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be positive, got " + windowDays);
        }
        LocalDate windowStart = windowStart(referenceDate, windowDays);
        Map<GroupKey, TreeMap<LocalDate, BigDecimal>> byKey = new TreeMap<>();
        for (CostRow row : rows) {
            LocalDate date = row.usageDate();
            if (date == null || date.isBefore(windowStart) || date.isAfter(referenceDate)) {
                continue;
            }
            BigDecimal cost = row.cost() != null ? row.cost() : BigDecimal.ZERO;
            if (cost.signum() < 0) {
                throw new IllegalArgumentException("negative cost " + cost + " on " + date
                        + "; credits and refunds must be excluded before detection");
            }
            byKey.computeIfAbsent(grouping.keyOf(row), key -> new TreeMap<>())
                    .merge(date, cost, BigDecimal::add);
        }
        List<GroupSeries> series = new ArrayList<>(byKey.size());
        byKey.forEach((key, costsByDate) -> {
            List<DailyCostPoint> points = new ArrayList<>(costsByDate.size());
            costsByDate.forEach((date, cost) -> points.add(new DailyCostPoint(date, cost)));
            series.add(new GroupSeries(key, points));
        });
        return series;
    }

    /**
     * First day of a window of {@code windowDays} days ending on (and including) {@code referenceDate}.
     */
    public static LocalDate windowStart(LocalDate referenceDate, int windowDays) {
        return referenceDate.minusDays(windowDays - 1L);
    }
}
