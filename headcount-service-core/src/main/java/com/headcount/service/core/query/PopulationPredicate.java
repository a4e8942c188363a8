package com.headcount.service.core.query;

import com.headcount.service.core.catalog.AnalysisCatalog;
import com.headcount.service.core.sql.SqlDialect;
import com.headcount.service.core.sql.SqlFragment;
import java.time.LocalDate;

/** Which employee records count as "the population" for a call. Shared by analyses and filter listings. */
public final class PopulationPredicate {

    public static final String SNAPSHOT_PARAM = "snapshot";

    private PopulationPredicate() {}

    /**
     * A snapshot date wins over {@code activeOnly}: a record belongs to the snapshot when it started on or
     * before that date and had not ended by then. Returns an empty fragment when every record counts.
     */
    public static SqlFragment of(SqlDialect dialect, boolean activeOnly, LocalDate snapshotDate) {
        if (snapshotDate != null) {
            String p = dialect.dateParameter(SNAPSHOT_PARAM);
            return SqlFragment.of(
                    AnalysisCatalog.COL_START_DATE + " <= " + p + " AND (" + AnalysisCatalog.COL_END_DATE
                            + " IS NULL OR " + AnalysisCatalog.COL_END_DATE + " > " + p + ")",
                    SNAPSHOT_PARAM,
                    dialect.bindDate(snapshotDate));
        }
        if (activeOnly) {
            return SqlFragment.literal(dialect.isTrue(AnalysisCatalog.COL_ACTIVE));
        }
        return SqlFragment.literal("");
    }
}
