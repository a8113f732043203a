package com.costwatch.anomaly.repository;

import com.costwatch.anomaly.model.CostRow;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the daily cost summary that ingestion maintains.
 */
public interface DailyCostRepository {

    /**
     * Usage cost per (date, service, account, region) between the two dates, both
     * inclusive, ordered by date. Non-usage line items are never returned.
     *
     * @param dataSource {@code cur} or {@code cost_explorer}; empty for every source
     */
    List<CostRow> findDailyCosts(LocalDate fromInclusive, LocalDate toInclusive, Optional<String> dataSource);

    boolean hasData();

    String storeType();
}
