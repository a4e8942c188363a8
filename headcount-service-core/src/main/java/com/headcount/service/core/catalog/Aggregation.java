package com.headcount.service.core.catalog;

import java.util.Objects;

/**
 * How a metric is reduced. The planner and the executor branch once on the concrete type:
 * a {@link Pushdown} is computed by the relational engine, a {@link PostAggregate} is reduced in
 * memory from raw per-row values.
 */
public interface Aggregation {

    /** Marker inside a pushdown template that is replaced with the metric's value expression. */
    String VALUE_TOKEN = "{value}";

    record Pushdown(String template) implements Aggregation {
        public Pushdown {
            Objects.requireNonNull(template, "template");
        }

        public boolean usesValue() {
            return template.contains(VALUE_TOKEN);
        }
    }

    record PostAggregate(Reducer reducer) implements Aggregation {
        public PostAggregate {
            Objects.requireNonNull(reducer, "reducer");
        }
    }

    static Aggregation pushdown(String template) {
        return new Pushdown(template);
    }

    static Aggregation postAggregate(Reducer reducer) {
        return new PostAggregate(reducer);
    }
}
