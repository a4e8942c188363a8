package com.headcount.service.core.repo;

import com.headcount.service.core.catalog.BucketKind;
import com.headcount.service.core.catalog.BucketRange;
import com.headcount.service.core.catalog.BucketRule;
import com.headcount.service.core.config.AnalysisProperties;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Reads the configured age brackets. Not cached: every call sees the current configuration. */
@Repository
@Slf4j
public class AgeBracketRepository {

    private final NamedParameterJdbcTemplate jdbc;
    private final AnalysisProperties properties;

    public AgeBracketRepository(NamedParameterJdbcTemplate jdbc, AnalysisProperties properties) {
        this.jdbc = jdbc;
        this.properties = properties;
    }

    public BucketRule load() {
        String sql = "SELECT min_age, max_age, label FROM " + properties.getAgeBracketTable()
                + " ORDER BY sort_order, label";
        List<BucketRange> ranges = jdbc.query(sql, (rs, rowNum) -> {
            int min = rs.getInt("min_age");
            Integer lower = rs.wasNull() ? null : min;
            int max = rs.getInt("max_age");
            Integer upper = rs.wasNull() ? null : max;
            return BucketRange.closed(lower, upper, rs.getString("label"));
        });
        if (ranges.isEmpty()) {
            log.debug("No age brackets configured in {}, using defaults", properties.getAgeBracketTable());
            return new BucketRule(BucketKind.AGE, properties.defaultAgeRanges());
        }
        return new BucketRule(BucketKind.AGE, ranges);
    }
}
