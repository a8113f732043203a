package com.costwatch.anomaly.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

public record DailyCostPoint(LocalDate date, BigDecimal cost) {

    public DailyCostPoint {
        Objects.requireNonNull(date, "date must be provided");
        Objects.requireNonNull(cost, "cost must be provided");
        if (cost.signum() < 0) {
            throw new IllegalArgumentException("cost must not be negative (date=" + date + ", cost=" + cost + ")");
        }
    }

    public double costValue() {
        return cost.doubleValue();
    }
}
