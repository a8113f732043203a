package com.costwatch.anomaly.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One aggregated row of the daily cost summary: the net amortized usage cost of a
 * (date, service, account, region) cell. Tax, fee, credit, refund and discount line
 * items are already excluded by the store.
 */
public record CostRow(
        LocalDate usageDate,
        String service,
        String account,
        String region,
        BigDecimal cost
) {

    public String valueOf(Dimension dimension) {
        return switch (dimension) {
            case SERVICE -> service;
            case ACCOUNT -> account;
            case REGION -> region;
        };
    }
}
