package com.headcount.service.core.query;

import java.util.List;
import java.util.Map;

/**
 * @param data group label to a rounded value, or to a map of split label to rounded value when the
 *     request had a split dimension
 */
public record AnalysisResult(Meta meta, Map<String, Object> data) {

    public record Meta(
            String metric,
            String metricLabel,
            String groupBy,
            String groupByLabel,
            String splitBy,
            String splitByLabel,
            Map<String, List<String>> filters,
            boolean activeOnly,
            String snapshotDate,
            int totalGroups) {}
}
