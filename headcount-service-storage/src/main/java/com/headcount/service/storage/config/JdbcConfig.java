package com.headcount.service.storage.config;

import com.headcount.service.core.sql.PostgresDialect;
import com.headcount.service.core.sql.SqlDialect;
import com.headcount.service.core.sql.SqliteDialect;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
@ConditionalOnClass(NamedParameterJdbcTemplate.class)
public class JdbcConfig {

    public static final String DIALECT_PREFIX = "headcount.storage";

    @Bean
    @ConditionalOnMissingBean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(SqlDialect.class)
    @ConditionalOnProperty(prefix = DIALECT_PREFIX, name = "dialect", havingValue = SqliteDialect.NAME, matchIfMissing = true)
    public SqlDialect sqliteDialect() {
        return new SqliteDialect();
    }

    @Bean
    @ConditionalOnMissingBean(SqlDialect.class)
    @ConditionalOnProperty(prefix = DIALECT_PREFIX, name = "dialect", havingValue = PostgresDialect.NAME)
    public SqlDialect postgresDialect() {
        return new PostgresDialect();
    }
}
