package com.headcount.service.core.sql;

import java.time.LocalDate;

public class PostgresDialect implements SqlDialect {

    public static final String NAME = "postgres";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String dateParameter(String name) {
        return "CAST(:" + name + " AS DATE)";
    }

    @Override
    public Object bindDate(LocalDate date) {
        return date;
    }

    @Override
    public String leastDate(String left, String right) {
        return "LEAST(" + left + ", " + right + ")";
    }

    @Override
    public String daysBetween(String startExpr, String endExpr) {
        // date - date yields an integer day count
        return "(" + endExpr + " - " + startExpr + ")";
    }

    @Override
    public String isTrue(String column) {
        return column + " = TRUE";
    }
}
