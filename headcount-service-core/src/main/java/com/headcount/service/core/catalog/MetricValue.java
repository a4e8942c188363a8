package com.headcount.service.core.catalog;

/**
 * The per-row quantity a metric aggregates: nothing (row counts), a stored numeric column, or the
 * derived tenure in years.
 */
public record MetricValue(Kind kind, String column) {

    public enum Kind {
        ROWS,
        COLUMN,
        TENURE_YEARS
    }

    public static MetricValue rows() {
        return new MetricValue(Kind.ROWS, null);
    }

    public static MetricValue column(String column) {
        return new MetricValue(Kind.COLUMN, column);
    }

    public static MetricValue tenureYears() {
        return new MetricValue(Kind.TENURE_YEARS, null);
    }
}
