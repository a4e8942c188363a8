package com.headcount.service.core.catalog;

import java.util.List;
import java.util.Objects;

/**
 * One whitelisted metric.
 *
 * @param guardColumns columns that must be non-null for a row to take part in this metric
 */
public record MetricDefinition(
        String id,
        String label,
        MetricValue value,
        Aggregation aggregation,
        Rounding rounding,
        List<String> guardColumns) {

    public MetricDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(aggregation, "aggregation");
        Objects.requireNonNull(rounding, "rounding");
        guardColumns = guardColumns == null ? List.of() : List.copyOf(guardColumns);
    }

    public boolean requiresPostAggregation() {
        return aggregation instanceof Aggregation.PostAggregate;
    }
}
