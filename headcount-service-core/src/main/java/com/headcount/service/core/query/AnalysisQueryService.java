package com.headcount.service.core.query;

import com.headcount.service.core.catalog.Aggregation;
import com.headcount.service.core.catalog.AnalysisCatalog;
import com.headcount.service.core.catalog.DimensionDefinition;
import com.headcount.service.core.catalog.MetricDefinition;
import com.headcount.service.core.catalog.Reducer;
import com.headcount.service.core.catalog.Rounding;
import com.headcount.service.core.repo.AgeBracketRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs analyses: plans the query, executes it and shapes the rows into {@link AnalysisResult}. Store
 * failures propagate as thrown by the JDBC layer; there is no partial result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisQueryService {

    private final AnalysisQueryPlanner planner;
    private final AnalysisQueryRepository repository;
    private final AgeBracketRepository ageBracketRepository;
    private final Clock clock;

    public AnalysisResult execute(AnalysisRequest request) {
        AnalysisQueryPlanner.ValidatedRequest validated = planner.validate(request);
        LocalDate referenceDate = request.snapshotDate() != null ? request.snapshotDate() : LocalDate.now(clock);
        PlanningContext context = new PlanningContext(ageBracketRepository.load(), referenceDate);
        PlannedQuery query = planner.plan(validated, context);

        Map<String, Object> data = query.rawValues()
                ? shapeReduced(validated.metric(), repository.fetchValues(query), query.split())
                : shapeAggregated(validated.metric(), repository.fetchAggregates(query), query);

        log.info(
                "Analysis metric={} groupBy={} splitBy={} filters={} activeOnly={} snapshotDate={} groups={}",
                request.metric(),
                request.groupBy(),
                request.splitBy(),
                request.filters().entries().keySet(),
                request.activeOnly(),
                request.snapshotDate(),
                data.size());
        return new AnalysisResult(meta(validated, data.size()), data);
    }

    private static Map<String, Object> shapeAggregated(
            MetricDefinition metric, List<AnalysisQueryRepository.AggregateRow> rows, PlannedQuery query) {
        Rounding rounding = metric.rounding();
        Map<String, Object> data = new LinkedHashMap<>();
        if (!query.grouped() && !query.split()) {
            Number value = rows.isEmpty() ? null : rows.get(0).value();
            data.put(AnalysisCatalog.TOTAL_KEY, rounding.apply(value));
            return data;
        }
        for (AnalysisQueryRepository.AggregateRow row : rows) {
            String group = groupKey(row.group());
            if (query.split()) {
                @SuppressWarnings("unchecked")
                Map<String, Object> inner =
                        (Map<String, Object>) data.computeIfAbsent(group, k -> new LinkedHashMap<String, Object>());
                inner.put(row.split(), rounding.apply(row.value()));
            } else {
                data.put(group, rounding.apply(row.value()));
            }
        }
        return data;
    }

    private static Map<String, Object> shapeReduced(
            MetricDefinition metric, List<AnalysisQueryRepository.ValueRow> rows, boolean split) {
        Reducer reducer = ((Aggregation.PostAggregate) metric.aggregation()).reducer();
        Rounding rounding = metric.rounding();

        Map<String, Map<String, List<Double>>> buckets = new TreeMap<>();
        for (AnalysisQueryRepository.ValueRow row : rows) {
            if (row.value() == null) continue;
            buckets.computeIfAbsent(groupKey(row.group()), k -> new TreeMap<>())
                    .computeIfAbsent(split ? row.split() : "", k -> new ArrayList<>())
                    .add(row.value());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        buckets.forEach((group, bySplit) -> {
            if (split) {
                Map<String, Object> inner = new LinkedHashMap<>();
                bySplit.forEach((s, values) -> inner.put(s, rounding.apply(reducer.reduce(values))));
                data.put(group, inner);
            } else {
                data.put(group, rounding.apply(reducer.reduce(bySplit.get(""))));
            }
        });
        return data;
    }

    private static String groupKey(String group) {
        return group == null ? AnalysisCatalog.TOTAL_KEY : group;
    }

    private static AnalysisResult.Meta meta(AnalysisQueryPlanner.ValidatedRequest validated, int totalGroups) {
        AnalysisRequest request = validated.request();
        DimensionDefinition group = validated.group();
        DimensionDefinition split = validated.split();
        return new AnalysisResult.Meta(
                validated.metric().id(),
                validated.metric().label(),
                request.groupBy(),
                group == null ? AnalysisCatalog.TOTAL_GROUP_LABEL : group.label(),
                split == null ? null : split.id(),
                split == null ? null : split.label(),
                request.filters().entries(),
                request.activeOnly(),
                request.snapshotDate() == null ? null : request.snapshotDate().toString(),
                totalGroups);
    }
}
