package com.headcount.service.core.query;

import java.time.LocalDate;

/**
 * One analysis call. A non-null {@code snapshotDate} replaces the active-only population with the
 * records employed on that date.
 */
public record AnalysisRequest(
        String metric, String groupBy, String splitBy, FilterSpec filters, boolean activeOnly, LocalDate snapshotDate) {

    public AnalysisRequest {
        if (splitBy != null && splitBy.isBlank()) splitBy = null;
        if (filters == null) filters = FilterSpec.empty();
    }

    public static AnalysisRequest of(String metric, String groupBy) {
        return new AnalysisRequest(metric, groupBy, null, FilterSpec.empty(), true, null);
    }

    public AnalysisRequest withSplitBy(String split) {
        return new AnalysisRequest(metric, groupBy, split, filters, activeOnly, snapshotDate);
    }

    public AnalysisRequest withFilters(FilterSpec spec) {
        return new AnalysisRequest(metric, groupBy, splitBy, spec, activeOnly, snapshotDate);
    }

    public AnalysisRequest withActiveOnly(boolean active) {
        return new AnalysisRequest(metric, groupBy, splitBy, filters, active, snapshotDate);
    }

    public AnalysisRequest withSnapshotDate(LocalDate date) {
        return new AnalysisRequest(metric, groupBy, splitBy, filters, activeOnly, date);
    }
}
