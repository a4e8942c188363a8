package com.headcount.service.core.query;

import java.util.Collections;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Named-parameter SQL ready for execution, with the result columns it exposes.
 *
 * @param grouped the query projects a {@code group_label} column
 * @param split the query projects a {@code split_label} column
 * @param rawValues rows carry one raw value per record instead of an aggregate
 */
public record PlannedQuery(
        String sql, MapSqlParameterSource params, boolean grouped, boolean split, boolean rawValues) {

    public static final String GROUP_COLUMN = "group_label";
    public static final String SPLIT_COLUMN = "split_label";
    public static final String VALUE_COLUMN = "metric_value";

    public PlannedQuery {
        params = params == null ? new MapSqlParameterSource() : params;
    }

    public Map<String, Object> values() {
        return Collections.unmodifiableMap(params.getValues());
    }
}
