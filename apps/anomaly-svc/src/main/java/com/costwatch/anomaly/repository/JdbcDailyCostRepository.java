package com.costwatch.anomaly.repository;

import com.costwatch.anomaly.model.CostRow;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(prefix = "costwatch.store", name = "type", havingValue = "jdbc")
public class JdbcDailyCostRepository implements DailyCostRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcDailyCostRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<CostRow> findDailyCosts(LocalDate fromInclusive, LocalDate toInclusive, Optional<String> dataSource) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("from", Date.valueOf(fromInclusive))
                .addValue("to", Date.valueOf(toInclusive));
        String sourceFilter = "";
        if (dataSource.isPresent()) {
            sourceFilter = " AND data_source = :dataSource";
            params.addValue("dataSource", dataSource.get());
        }
        String sql = """
                SELECT usage_date,
                       product_code,
                       usage_account_id,
                       region,
                       SUM(total_net_amortized_cost) AS daily_cost
                FROM daily_cost_summary
                WHERE usage_date >= :from
                  AND usage_date <= :to%s
                GROUP BY usage_date, product_code, usage_account_id, region
                ORDER BY usage_date, product_code, usage_account_id, region
                """.formatted(sourceFilter);
        return jdbcTemplate.query(sql, params, this::mapRow);
    }

    @Override
    public boolean hasData() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM daily_cost_summary",
                new MapSqlParameterSource(), Long.class);
        return count != null && count > 0;
    }

    @Override
    public String storeType() {
        return "jdbc";
    }

    private CostRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new CostRow(
                rs.getDate("usage_date").toLocalDate(),
                rs.getString("product_code"),
                rs.getString("usage_account_id"),
                rs.getString("region"),
                rs.getBigDecimal("daily_cost")
        );
    }
}
