package com.headcount.service.core.repo;

import com.headcount.service.core.config.AnalysisProperties;
import com.headcount.service.core.sql.SqlFragment;
import java.util.List;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class FilterValueRepository {

    private final NamedParameterJdbcTemplate jdbc;
    private final AnalysisProperties properties;

    public FilterValueRepository(NamedParameterJdbcTemplate jdbc, AnalysisProperties properties) {
        this.jdbc = jdbc;
        this.properties = properties;
    }

    /**
     * Distinct non-null values of {@code column} within the population, ascending. The column must come
     * from the catalog.
     */
    public List<String> distinctValues(String column, SqlFragment population) {
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT DISTINCT ")
                .append(column)
                .append(" FROM ")
                .append(properties.getEmployeeTable())
                .append(" WHERE ")
                .append(column)
                .append(" IS NOT NULL ")
                .append(population.isEmpty() ? "" : "AND " + population.sql() + " ")
                .append("ORDER BY ")
                .append(column);
        return jdbc.queryForList(sql.toString(), population.params(), String.class);
    }
}
