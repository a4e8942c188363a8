package com.headcount.service.core.sql;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * A piece of SQL text together with the values its {@code :name} placeholders bind to. Fragments are
 * composed by concatenation; caller-supplied values only ever travel in {@link #params()}.
 *
 * <p>A name may appear in several fragments as long as every occurrence binds the same value.
 */
public record SqlFragment(String sql, MapSqlParameterSource params) {

    public SqlFragment {
        Objects.requireNonNull(sql, "sql");
        params = params == null ? new MapSqlParameterSource() : new MapSqlParameterSource(params.getValues());
    }

    public static SqlFragment of(String sql, String name, Object value) {
        return new SqlFragment(sql, new MapSqlParameterSource(name, value));
    }

    public static SqlFragment literal(String sql) {
        return new SqlFragment(sql, null);
    }

    /** A fresh copy, safe to hand to {@code NamedParameterJdbcTemplate}. */
    @Override
    public MapSqlParameterSource params() {
        return new MapSqlParameterSource(params.getValues());
    }

    public Map<String, Object> values() {
        return Collections.unmodifiableMap(params.getValues());
    }

    public SqlFragment wrap(String prefix, String suffix) {
        return new SqlFragment(prefix + sql + suffix, params);
    }

    public SqlFragment append(SqlFragment other) {
        MapSqlParameterSource merged = new MapSqlParameterSource(params.getValues());
        merge(merged, other.params);
        return new SqlFragment(sql + other.sql, merged);
    }

    public static SqlFragment join(String separator, Collection<SqlFragment> parts) {
        StringBuilder sb = new StringBuilder();
        MapSqlParameterSource merged = new MapSqlParameterSource();
        boolean first = true;
        for (SqlFragment part : parts) {
            if (!first) sb.append(separator);
            sb.append(part.sql);
            merge(merged, part.params);
            first = false;
        }
        return new SqlFragment(sb.toString(), merged);
    }

    public boolean isEmpty() {
        return sql.isBlank();
    }

    private static void merge(MapSqlParameterSource into, MapSqlParameterSource from) {
        for (Map.Entry<String, Object> e : from.getValues().entrySet()) {
            String name = e.getKey();
            if (into.hasValue(name) && !Objects.equals(into.getValue(name), e.getValue())) {
                throw new IllegalStateException("parameter :" + name + " is bound to two different values");
            }
            into.addValue(name, e.getValue());
        }
    }
}
