package com.headcount.service.core.query;

import com.headcount.service.core.catalog.Aggregation;
import com.headcount.service.core.catalog.AnalysisCatalog;
import com.headcount.service.core.catalog.DimensionDefinition;
import com.headcount.service.core.catalog.MetricDefinition;
import com.headcount.service.core.config.AnalysisProperties;
import com.headcount.service.core.sql.SqlDialect;
import com.headcount.service.core.sql.SqlFragment;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Validates an {@link AnalysisRequest} against the catalog and builds its SQL. Identifiers in the
 * generated text come from the catalog only; request values and configured bucket bounds are bound as
 * parameters.
 */
@Component
public class AnalysisQueryPlanner {

    private static final Pattern VALUE_TOKEN = Pattern.compile(Pattern.quote(Aggregation.VALUE_TOKEN));

    private final AnalysisCatalog catalog;
    private final DimensionResolver resolver;
    private final SqlDialect dialect;
    private final AnalysisProperties properties;

    public AnalysisQueryPlanner(
            AnalysisCatalog catalog, DimensionResolver resolver, SqlDialect dialect, AnalysisProperties properties) {
        this.catalog = catalog;
        this.resolver = resolver;
        this.dialect = dialect;
        this.properties = properties;
    }

    /** Checks every identifier in the request, in the order metric, group, split, filters. */
    public ValidatedRequest validate(AnalysisRequest request) {
        if (request == null) throw new IllegalArgumentException("analysis request is required");
        MetricDefinition metric = catalog.metric(request.metric())
                .orElseThrow(() -> new AnalysisValidationException("metric", request.metric(), catalog.metricIds()));

        DimensionDefinition group = null;
        if (!catalog.isTotalGroup(request.groupBy())) {
            group = catalog.dimension(request.groupBy())
                    .orElseThrow(() ->
                            new AnalysisValidationException("groupBy", request.groupBy(), catalog.groupIds()));
        }

        DimensionDefinition split = null;
        if (request.splitBy() != null) {
            split = catalog.dimension(request.splitBy())
                    .orElseThrow(() ->
                            new AnalysisValidationException("splitBy", request.splitBy(), catalog.dimensionIds()));
        }

        Map<DimensionDefinition, List<String>> filters = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : request.filters().entries().entrySet()) {
            DimensionDefinition dim = catalog.filterableDimension(e.getKey())
                    .orElseThrow(() -> new AnalysisValidationException("filters", e.getKey(), catalog.filterIds()));
            filters.put(dim, e.getValue());
        }
        return new ValidatedRequest(request, metric, group, split, filters);
    }

    public PlannedQuery plan(AnalysisRequest request, PlanningContext context) {
        return plan(validate(request), context);
    }

    public PlannedQuery plan(ValidatedRequest request, PlanningContext context) {
        MetricDefinition metric = request.metric();
        DimensionResolver.ResolvedDimension group =
                request.group() == null ? null : resolver.resolve(request.group(), context);
        DimensionResolver.ResolvedDimension split =
                request.split() == null ? null : resolver.resolve(request.split(), context);

        SqlFragment where = where(request, group, split);
        boolean raw = metric.aggregation() instanceof Aggregation.PostAggregate;

        List<SqlFragment> select = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        if (group != null) {
            select.add(group.expression().wrap("", " AS " + PlannedQuery.GROUP_COLUMN));
            keys.add(PlannedQuery.GROUP_COLUMN);
        }
        if (split != null) {
            select.add(split.expression().wrap("", " AS " + PlannedQuery.SPLIT_COLUMN));
            keys.add(PlannedQuery.SPLIT_COLUMN);
        }
        SqlFragment value = raw ? rawValue(metric, context) : aggregate(metric, context);
        select.add(value.wrap("", " AS " + PlannedQuery.VALUE_COLUMN));

        SqlFragment sql = SqlFragment.join(", ", select)
                .wrap("SELECT ", " FROM " + properties.getEmployeeTable())
                .append(where);
        if (!raw && !keys.isEmpty()) {
            sql = sql.append(SqlFragment.literal(" GROUP BY " + String.join(", ", keys) + " ORDER BY " + keys.get(0)));
        }
        return new PlannedQuery(sql.sql(), sql.params(), group != null, split != null, raw);
    }

    private SqlFragment where(
            ValidatedRequest request,
            DimensionResolver.ResolvedDimension group,
            DimensionResolver.ResolvedDimension split) {
        List<SqlFragment> predicates = new ArrayList<>();
        SqlFragment population = PopulationPredicate.of(
                dialect, request.request().activeOnly(), request.request().snapshotDate());
        if (!population.isEmpty()) predicates.add(population);

        Set<String> guards = new LinkedHashSet<>(request.metric().guardColumns());
        if (group != null) guards.addAll(group.guardColumns());
        if (split != null) guards.addAll(split.guardColumns());
        guards.forEach(col -> predicates.add(SqlFragment.literal(col + " IS NOT NULL")));

        int i = 0;
        for (Map.Entry<DimensionDefinition, List<String>> e : request.filters().entrySet()) {
            predicates.add(filterPredicate("f" + i++, e.getKey(), e.getValue()));
        }

        if (predicates.isEmpty()) return SqlFragment.literal("");
        return SqlFragment.join(" AND ", predicates).wrap(" WHERE ", "");
    }

    /** {@code NamedParameterJdbcTemplate} expands a list-valued {@code :name} inside {@code IN (...)}. */
    private static SqlFragment filterPredicate(String name, DimensionDefinition dim, List<String> values) {
        if (values.size() == 1) {
            return SqlFragment.of(dim.column() + " = :" + name, name, values.get(0));
        }
        return SqlFragment.of(dim.column() + " IN (:" + name + ")", name, List.copyOf(values));
    }

    private SqlFragment aggregate(MetricDefinition metric, PlanningContext context) {
        Aggregation.Pushdown pushdown = (Aggregation.Pushdown) metric.aggregation();
        if (!pushdown.usesValue()) return SqlFragment.literal(pushdown.template());
        SqlFragment value = rawValue(metric, context);
        String[] pieces = VALUE_TOKEN.split(pushdown.template(), -1);
        SqlFragment out = SqlFragment.literal(pieces[0]);
        for (int i = 1; i < pieces.length; i++) {
            out = out.append(value).append(SqlFragment.literal(pieces[i]));
        }
        return out;
    }

    private SqlFragment rawValue(MetricDefinition metric, PlanningContext context) {
        return switch (metric.value().kind()) {
            case COLUMN -> SqlFragment.literal(metric.value().column());
            case TENURE_YEARS -> resolver.tenureYears(context);
            case ROWS -> throw new IllegalStateException("metric " + metric.id() + " has no per-row value");
        };
    }

    /** A request whose identifiers have all been resolved against the catalog. */
    public record ValidatedRequest(
            AnalysisRequest request,
            MetricDefinition metric,
            DimensionDefinition group,
            DimensionDefinition split,
            Map<DimensionDefinition, List<String>> filters) {}
}
