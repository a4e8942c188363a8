package com.headcount.service.core.sql;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class SqlDialectTest {

    private final SqlDialect sqlite = new SqliteDialect();
    private final SqlDialect postgres = new PostgresDialect();

    @Test
    void sqliteBindsDatesAsIsoText() {
        assertThat(sqlite.dateParameter("snapshot")).isEqualTo(":snapshot");
        assertThat(sqlite.bindDate(LocalDate.of(2025, 1, 1))).isEqualTo("2025-01-01");
        assertThat(sqlite.daysBetween("a", "b")).isEqualTo("(JULIANDAY(b) - JULIANDAY(a))");
        assertThat(sqlite.leastDate("x", "y")).isEqualTo("MIN(x, y)");
        assertThat(sqlite.isTrue("is_active")).isEqualTo("is_active = 1");
    }

    @Test
    void postgresCastsDateParameters() {
        assertThat(postgres.dateParameter("ref")).isEqualTo("CAST(:ref AS DATE)");
        assertThat(postgres.bindDate(LocalDate.of(2025, 1, 1))).isEqualTo(LocalDate.of(2025, 1, 1));
        assertThat(postgres.daysBetween("a", "b")).isEqualTo("(b - a)");
        assertThat(postgres.leastDate("x", "y")).isEqualTo("LEAST(x, y)");
        assertThat(postgres.isTrue("is_active")).isEqualTo("is_active = TRUE");
    }
}
