package com.headcount.service.core.query;

import com.headcount.service.core.catalog.AnalysisCatalog;
import com.headcount.service.core.catalog.BucketRange;
import com.headcount.service.core.catalog.BucketRule;
import com.headcount.service.core.catalog.DimensionDefinition;
import com.headcount.service.core.sql.SqlDialect;
import com.headcount.service.core.sql.SqlFragment;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Turns a catalog dimension into the SQL expression rows are grouped by. */
@Component
public class DimensionResolver {

    static final double DAYS_PER_YEAR = 365.25d;
    static final String REFERENCE_PARAM = "ref";

    private final AnalysisCatalog catalog;
    private final SqlDialect dialect;

    public DimensionResolver(AnalysisCatalog catalog, SqlDialect dialect) {
        this.catalog = catalog;
        this.dialect = dialect;
    }

    public ResolvedDimension resolve(DimensionDefinition dimension, PlanningContext context) {
        if (!dimension.computed()) {
            SqlFragment expr = SqlFragment.literal(
                    "COALESCE(" + dimension.column() + ", '" + AnalysisCatalog.UNKNOWN + "')");
            return new ResolvedDimension(expr, dimension.guardColumns());
        }
        SqlFragment expr = switch (dimension.bucket()) {
            case AGE -> bucketCase(SqlFragment.literal(AnalysisCatalog.COL_AGE), context.ageBrackets());
            case TENURE -> bucketCase(tenureYears(context), catalog.tenureBrackets());
        };
        return new ResolvedDimension(expr, dimension.guardColumns());
    }

    /**
     * Years employed up to the reference date. A record that ended earlier stops counting at its end date;
     * an end date after the reference date does not extend tenure.
     */
    public SqlFragment tenureYears(PlanningContext context) {
        String p = dialect.dateParameter(REFERENCE_PARAM);
        String until = dialect.leastDate("COALESCE(" + AnalysisCatalog.COL_END_DATE + ", " + p + ")", p);
        return SqlFragment.of(
                "(" + dialect.daysBetween(AnalysisCatalog.COL_START_DATE, until) + " / " + DAYS_PER_YEAR + ")",
                REFERENCE_PARAM,
                dialect.bindDate(context.referenceDate()));
    }

    /** Bound names are prefixed with the bucket kind, e.g. {@code :age_min0}, so two rules can share a query. */
    SqlFragment bucketCase(SqlFragment value, BucketRule rule) {
        String prefix = rule.kind().name().toLowerCase(Locale.ROOT) + "_";
        List<SqlFragment> parts = new ArrayList<>();
        parts.add(SqlFragment.literal("CASE"));
        int i = 0;
        for (BucketRange range : rule.ascending()) {
            List<SqlFragment> conditions = new ArrayList<>();
            if (range.min() != null) {
                String name = prefix + "min" + i;
                conditions.add(value.append(SqlFragment.of(" >= :" + name, name, range.min())));
            }
            if (range.max() != null) {
                String name = prefix + "max" + i;
                String op = range.maxInclusive() ? " <= :" : " < :";
                conditions.add(value.append(SqlFragment.of(op + name, name, range.max())));
            }
            String label = prefix + "label" + i;
            parts.add(SqlFragment.join(" AND ", conditions)
                    .wrap("WHEN ", "")
                    .append(SqlFragment.of(" THEN :" + label, label, range.label())));
            i++;
        }
        parts.add(SqlFragment.literal("ELSE '" + AnalysisCatalog.UNKNOWN + "' END"));
        return SqlFragment.join(" ", parts);
    }

    /**
     * @param guardColumns columns that must be non-null for a row to be grouped under this dimension
     */
    public record ResolvedDimension(SqlFragment expression, List<String> guardColumns) {}
}
