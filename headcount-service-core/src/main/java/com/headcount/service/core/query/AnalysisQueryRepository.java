package com.headcount.service.core.query;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@Slf4j
public class AnalysisQueryRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public AnalysisQueryRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /** Rows of an aggregating query. The value is whatever numeric type the driver returns, or null. */
    public List<AggregateRow> fetchAggregates(PlannedQuery query) {
        log(query);
        return jdbc.query(
                query.sql(),
                query.params(),
                (rs, rowNum) -> new AggregateRow(
                        label(rs, query.grouped(), PlannedQuery.GROUP_COLUMN),
                        label(rs, query.split(), PlannedQuery.SPLIT_COLUMN),
                        (Number) rs.getObject(PlannedQuery.VALUE_COLUMN)));
    }

    /** One row per record for metrics reduced in memory. */
    public List<ValueRow> fetchValues(PlannedQuery query) {
        log(query);
        return jdbc.query(
                query.sql(),
                query.params(),
                (rs, rowNum) -> {
                    double v = rs.getDouble(PlannedQuery.VALUE_COLUMN);
                    Double value = rs.wasNull() ? null : v;
                    return new ValueRow(
                            label(rs, query.grouped(), PlannedQuery.GROUP_COLUMN),
                            label(rs, query.split(), PlannedQuery.SPLIT_COLUMN),
                            value);
                });
    }

    private static String label(ResultSet rs, boolean present, String column) throws SQLException {
        return present ? rs.getString(column) : null;
    }

    private static void log(PlannedQuery query) {
        if (log.isDebugEnabled()) {
            log.debug("Analysis SQL ({} params): {}", query.params().getParameterNames().length, query.sql());
        }
    }

    public record AggregateRow(String group, String split, Number value) {}

    public record ValueRow(String group, String split, Double value) {}
}
