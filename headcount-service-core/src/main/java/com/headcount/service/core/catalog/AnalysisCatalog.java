package com.headcount.service.core.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Whitelist of every metric and dimension the analysis engine understands. Built once and read-only;
 * an identifier missing here is invalid everywhere downstream.
 */
@Component
public class AnalysisCatalog {

    /** Group id meaning "no grouping, one total row". */
    public static final String TOTAL_GROUP = "all";

    public static final String TOTAL_GROUP_LABEL = "All (total)";

    /** Key of the single entry an ungrouped analysis returns. */
    public static final String TOTAL_KEY = "All";

    /** Bucket and null-coalesce fallback. */
    public static final String UNKNOWN = "Unknown";

    public static final String COL_SALARY = "salary";
    public static final String COL_AGE = "age";
    public static final String COL_START_DATE = "start_date";
    public static final String COL_END_DATE = "end_date";
    public static final String COL_WEEKLY_HOURS = "weekly_hours";
    public static final String COL_ACTIVE = "is_active";

    private final Map<String, MetricDefinition> metrics;
    private final Map<String, DimensionDefinition> dimensions;
    private final Map<String, DimensionDefinition> filterable;
    private final BucketRule tenureBrackets;

    public AnalysisCatalog() {
        this.metrics = Collections.unmodifiableMap(buildMetrics());
        this.dimensions = Collections.unmodifiableMap(buildDimensions());
        Map<String, DimensionDefinition> f = new LinkedHashMap<>();
        dimensions.values().stream().filter(DimensionDefinition::filterable).forEach(d -> f.put(d.id(), d));
        this.filterable = Collections.unmodifiableMap(f);
        this.tenureBrackets = new BucketRule(
                BucketKind.TENURE,
                List.of(
                        BucketRange.halfOpen(null, 1.0d, "Under 1 year"),
                        BucketRange.halfOpen(1.0d, 2.0d, "1-2 years"),
                        BucketRange.halfOpen(2.0d, 5.0d, "2-5 years"),
                        BucketRange.halfOpen(5.0d, 10.0d, "5-10 years"),
                        BucketRange.halfOpen(10.0d, null, "Over 10 years")));
    }

    private static Map<String, MetricDefinition> buildMetrics() {
        Map<String, MetricDefinition> m = new LinkedHashMap<>();
        addMetric(m, new MetricDefinition(
                "count", "Headcount", MetricValue.rows(), Aggregation.pushdown("COUNT(*)"), Rounding.WHOLE_NUMBER, List.of()));
        addMetric(m, salary("avg_salary", "Average salary", Aggregation.pushdown("AVG({value})")));
        addMetric(m, salary("median_salary", "Median salary", Aggregation.postAggregate(Reducer.MEDIAN)));
        addMetric(m, salary("min_salary", "Lowest salary", Aggregation.pushdown("MIN({value})")));
        addMetric(m, salary("max_salary", "Highest salary", Aggregation.pushdown("MAX({value})")));
        addMetric(m, salary("sum_salary", "Total payroll", Aggregation.pushdown("SUM({value})")));
        addMetric(m, new MetricDefinition(
                "avg_age",
                "Average age",
                MetricValue.column(COL_AGE),
                Aggregation.pushdown("AVG({value})"),
                Rounding.ZERO_DECIMALS,
                List.of(COL_AGE)));
        addMetric(m, new MetricDefinition(
                "median_age",
                "Median age",
                MetricValue.column(COL_AGE),
                Aggregation.postAggregate(Reducer.MEDIAN),
                Rounding.ZERO_DECIMALS,
                List.of(COL_AGE)));
        addMetric(m, new MetricDefinition(
                "avg_tenure",
                "Average tenure (years)",
                MetricValue.tenureYears(),
                Aggregation.pushdown("AVG({value})"),
                Rounding.ONE_DECIMAL,
                List.of(COL_START_DATE)));
        addMetric(m, new MetricDefinition(
                "avg_work_hours",
                "Average weekly hours",
                MetricValue.column(COL_WEEKLY_HOURS),
                Aggregation.pushdown("AVG({value})"),
                Rounding.ZERO_DECIMALS,
                List.of(COL_WEEKLY_HOURS)));
        addMetric(m, new MetricDefinition(
                "pct_female",
                "Share of women (%)",
                MetricValue.rows(),
                Aggregation.pushdown(
                        "100.0 * SUM(CASE WHEN gender IN ('Kvinne', 'Female') THEN 1 ELSE 0 END) / COUNT(*)"),
                Rounding.ONE_DECIMAL,
                List.of()));
        addMetric(m, new MetricDefinition(
                "pct_leaders",
                "Share of leaders (%)",
                MetricValue.rows(),
                Aggregation.pushdown(
                        "100.0 * SUM(CASE WHEN LOWER(is_leader) IN ('ja', 'yes', '1', 'true') THEN 1 ELSE 0 END)"
                                + " / COUNT(*)"),
                Rounding.ONE_DECIMAL,
                List.of()));
        return m;
    }

    private static MetricDefinition salary(String id, String label, Aggregation aggregation) {
        return new MetricDefinition(
                id, label, MetricValue.column(COL_SALARY), aggregation, Rounding.ZERO_DECIMALS, List.of(COL_SALARY));
    }

    private static Map<String, DimensionDefinition> buildDimensions() {
        Map<String, DimensionDefinition> d = new LinkedHashMap<>();
        addDimension(d, DimensionDefinition.column("department", "Department", "department"));
        addDimension(d, DimensionDefinition.column("legal_entity", "Legal entity", "legal_entity"));
        addDimension(d, DimensionDefinition.column("country", "Country", "work_country"));
        addDimension(d, DimensionDefinition.column("gender", "Gender", "gender"));
        addDimension(d, DimensionDefinition.bucketed("age_group", "Age group", BucketKind.AGE, COL_AGE));
        addDimension(d, DimensionDefinition.column("job_family", "Job family", "job_family"));
        addDimension(d, DimensionDefinition.column("employment_type", "Employment type", "employment_type"));
        addDimension(d, DimensionDefinition.column("is_leader", "Leader / non-leader", "is_leader"));
        addDimension(d, DimensionDefinition.column("cost_center", "Cost center", "cost_center"));
        addDimension(d, DimensionDefinition.bucketed("tenure_group", "Tenure", BucketKind.TENURE, COL_START_DATE));
        addDimension(d, DimensionDefinition.column("employment_level", "Employment level", "employment_level"));
        addDimension(d, DimensionDefinition.column("nationality", "Nationality", "nationality"));
        addDimension(d, DimensionDefinition.column("work_location", "Work location", "work_location"));
        addDimension(d, DimensionDefinition.column("division", "Division", "division"));
        addDimension(d, DimensionDefinition.column("role", "Role", "role"));
        return d;
    }

    private static void addMetric(Map<String, MetricDefinition> m, MetricDefinition def) {
        m.put(def.id(), def);
    }

    private static void addDimension(Map<String, DimensionDefinition> m, DimensionDefinition def) {
        m.put(def.id(), def);
    }

    public Optional<MetricDefinition> metric(String id) {
        return Optional.ofNullable(id == null ? null : metrics.get(id));
    }

    public Optional<DimensionDefinition> dimension(String id) {
        return Optional.ofNullable(id == null ? null : dimensions.get(id));
    }

    public Optional<DimensionDefinition> filterableDimension(String id) {
        return Optional.ofNullable(id == null ? null : filterable.get(id));
    }

    public boolean isTotalGroup(String id) {
        return TOTAL_GROUP.equals(id);
    }

    public Collection<MetricDefinition> metrics() {
        return metrics.values();
    }

    public Collection<DimensionDefinition> dimensions() {
        return dimensions.values();
    }

    public Collection<DimensionDefinition> filterableDimensions() {
        return filterable.values();
    }

    public List<String> metricIds() {
        return List.copyOf(metrics.keySet());
    }

    /** Valid {@code group_by} values: every dimension plus the total sentinel. */
    public List<String> groupIds() {
        List<String> ids = new ArrayList<>(dimensions.keySet());
        ids.add(TOTAL_GROUP);
        return List.copyOf(ids);
    }

    public List<String> dimensionIds() {
        return List.copyOf(dimensions.keySet());
    }

    public List<String> filterIds() {
        return List.copyOf(filterable.keySet());
    }

    public BucketRule tenureBrackets() {
        return tenureBrackets;
    }
}
