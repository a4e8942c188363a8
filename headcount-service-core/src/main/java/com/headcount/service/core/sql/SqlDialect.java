package com.headcount.service.core.sql;

import java.time.LocalDate;

/**
 * The handful of places where the analysis SQL differs between record stores. Every method returns
 * SQL built from column names that the caller already took from the catalog.
 */
public interface SqlDialect {

    String name();

    /** Named placeholder for a date parameter, e.g. {@code :snapshot} or {@code CAST(:snapshot AS DATE)}. */
    String dateParameter(String name);

    /** The JDBC value bound for a date placeholder. */
    Object bindDate(LocalDate date);

    /** Smaller of two date expressions. */
    String leastDate(String left, String right);

    /** Elapsed whole and fractional days from {@code startExpr} to {@code endExpr}. */
    String daysBetween(String startExpr, String endExpr);

    /** Predicate testing a boolean flag column for true. */
    String isTrue(String column);
}
