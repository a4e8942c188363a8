package com.headcount.service.core.sql;

import java.time.LocalDate;

/** SQLite stores dates as ISO-8601 text and booleans as 0/1. */
public class SqliteDialect implements SqlDialect {

    public static final String NAME = "sqlite";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String dateParameter(String name) {
        return ":" + name;
    }

    @Override
    public Object bindDate(LocalDate date) {
        return date.toString();
    }

    @Override
    public String leastDate(String left, String right) {
        return "MIN(" + left + ", " + right + ")";
    }

    @Override
    public String daysBetween(String startExpr, String endExpr) {
        return "(JULIANDAY(" + endExpr + ") - JULIANDAY(" + startExpr + "))";
    }

    @Override
    public String isTrue(String column) {
        return column + " = 1";
    }
}
