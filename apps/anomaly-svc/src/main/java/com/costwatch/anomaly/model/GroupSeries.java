package com.costwatch.anomaly.model;

import java.util.List;
import java.util.Objects;

/**
 * Chronological daily costs of one group inside the detection window. Dates are
 * strictly increasing; days without a recorded cost are simply absent.
 */
public record GroupSeries(GroupKey key, List<DailyCostPoint> points) {

    public GroupSeries {
        Objects.requireNonNull(key, "key must be provided");
        points = List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).date().isAfter(points.get(i - 1).date())) {
                throw new IllegalArgumentException("series " + key + " dates must be strictly increasing, "
                        + points.get(i - 1).date() + " is followed by " + points.get(i).date());
            }
        }
    }

    public int size() {
        return points.size();
    }

    public DailyCostPoint last() {
        return points.get(points.size() - 1);
    }

    public double[] costs() {
        double[] costs = new double[points.size()];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = points.get(i).costValue();
        }
        return costs;
    }
}
