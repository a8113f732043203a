package com.costwatch.anomaly.repository;

import com.costwatch.anomaly.model.CostRow;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "costwatch.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDailyCostRepository implements DailyCostRepository {

    private static final String DEFAULT_SOURCE = "cur";

    private final List<StoredRow> storage = new CopyOnWriteArrayList<>();

    public void save(CostRow row) {
        save(row, DEFAULT_SOURCE);
    }

    public void save(CostRow row, String dataSource) {
        Objects.requireNonNull(row.usageDate(), "usageDate must be provided");
        if (row.cost() != null && row.cost().compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("daily summary rows carry usage cost only, got " + row.cost());
        }
        storage.add(new StoredRow(row, dataSource.toLowerCase(Locale.ROOT)));
    }

    public void saveAll(List<CostRow> rows) {
        rows.forEach(this::save);
    }

    public void clear() {
        storage.clear();
    }

    @Override
    public List<CostRow> findDailyCosts(LocalDate fromInclusive, LocalDate toInclusive, Optional<String> dataSource) {
        Optional<String> source = dataSource.map(value -> value.toLowerCase(Locale.ROOT));
        return storage.stream()
                .filter(stored -> source.map(stored.dataSource()::equals).orElse(true))
                .map(StoredRow::row)
                .filter(row -> !row.usageDate().isBefore(fromInclusive) && !row.usageDate().isAfter(toInclusive))
                .sorted(Comparator.comparing(CostRow::usageDate))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public boolean hasData() {
        return !storage.isEmpty();
    }

    @Override
    public String storeType() {
        return "memory";
    }

    private record StoredRow(CostRow row, String dataSource) {
    }
}
