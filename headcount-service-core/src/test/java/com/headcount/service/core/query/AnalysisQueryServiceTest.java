package com.headcount.service.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.headcount.service.core.fixtures.EmployeeFixtures;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

class AnalysisQueryServiceTest {

    private EmployeeFixtures fixtures;
    private AnalysisQueryService service;

    @BeforeEach
    void setUp() {
        fixtures = EmployeeFixtures.seeded();
        service = fixtures.queryService();
    }

    @AfterEach
    void tearDown() {
        fixtures.close();
    }

    @Test
    void countsActiveEmployeesByGender() {
        AnalysisResult result = service.execute(AnalysisRequest.of("count", "gender"));

        assertThat(result.data()).containsExactly(Map.entry("Kvinne", 3L), Map.entry("Mann", 5L));
        assertThat(result.meta().totalGroups()).isEqualTo(2);
        assertThat(result.meta().metricLabel()).isEqualTo("Headcount");
        assertThat(result.meta().groupByLabel()).isEqualTo("Gender");
        assertThat(result.meta().splitBy()).isNull();
    }

    @Test
    void snapshotOverridesActiveFlag() {
        AnalysisResult result = service.execute(
                AnalysisRequest.of("count", "all").withSnapshotDate(LocalDate.of(2025, 1, 1)));

        assertThat(result.data()).containsExactly(Map.entry("All", 9L));
        assertThat(result.meta().snapshotDate()).isEqualTo("2025-01-01");
        assertThat(result.meta().groupByLabel()).isEqualTo("All (total)");
    }

    @Test
    void snapshotCountsShrinkBeforeHires() {
        long early = total(AnalysisRequest.of("count", "all").withSnapshotDate(LocalDate.of(2020, 6, 1)));
        long later = total(AnalysisRequest.of("count", "all").withSnapshotDate(LocalDate.of(2025, 1, 1)));
        long afterTermination = total(AnalysisRequest.of("count", "all").withSnapshotDate(LocalDate.of(2025, 7, 1)));

        assertThat(early).isEqualTo(7L);
        assertThat(later).isEqualTo(9L);
        assertThat(afterTermination).isEqualTo(8L);
    }

    @Test
    void recordEndingOnSnapshotDateIsExcluded() {
        LocalDate lastDay = LocalDate.of(2024, 12, 31);
        AnalysisRequest advisers = AnalysisRequest.of("count", "all").withFilters(FilterSpec.single("role", "Rådgiver"));

        assertThat(total(advisers.withSnapshotDate(lastDay))).isZero();
        assertThat(total(advisers.withSnapshotDate(lastDay.minusDays(1)))).isEqualTo(1L);
        assertThat(total(AnalysisRequest.of("count", "all").withSnapshotDate(lastDay))).isEqualTo(9L);
    }

    @Test
    void recordStartingOnSnapshotDateIsIncluded() {
        LocalDate firstDay = LocalDate.of(2024, 6, 1);
        AnalysisRequest temps =
                AnalysisRequest.of("count", "all").withFilters(FilterSpec.single("employment_type", "Vikar"));

        assertThat(total(temps.withSnapshotDate(firstDay))).isEqualTo(1L);
        assertThat(total(temps.withSnapshotDate(firstDay.minusDays(1)))).isZero();
        assertThat(total(AnalysisRequest.of("count", "all").withSnapshotDate(firstDay))).isEqualTo(10L);
    }

    @Test
    void includesInactiveWhenRequested() {
        assertThat(total(AnalysisRequest.of("count", "all").withActiveOnly(false))).isEqualTo(10L);
    }

    @Test
    void multiValueFilterEqualsSumOfSingleFilters() {
        AnalysisResult both = service.execute(AnalysisRequest.of("count", "country")
                .withFilters(FilterSpec.of(Map.of("country", List.of("Norge", "Danmark")))));
        AnalysisResult norway = service.execute(
                AnalysisRequest.of("count", "country").withFilters(FilterSpec.single("country", "Norge")));
        AnalysisResult denmark = service.execute(
                AnalysisRequest.of("count", "country").withFilters(FilterSpec.single("country", "Danmark")));

        assertThat(both.data()).containsExactly(Map.entry("Danmark", 2L), Map.entry("Norge", 5L));
        assertThat(sum(both)).isEqualTo(sum(norway) + sum(denmark));
    }

    @Test
    void emptyFilterSetDoesNotNarrow() {
        AnalysisResult result = service.execute(AnalysisRequest.of("count", "all")
                .withFilters(FilterSpec.of(Map.of("country", List.of()))));

        assertThat(result.data()).containsEntry("All", 8L);
        assertThat(result.meta().filters()).isEmpty();
    }

    @Test
    void medianSalaryIsReducedInMemory() {
        AnalysisResult total = service.execute(AnalysisRequest.of("median_salary", "all"));
        AnalysisResult byGender = service.execute(AnalysisRequest.of("median_salary", "gender"));

        assertThat(total.data()).containsExactly(Map.entry("All", 565000.0d));
        assertThat(byGender.data()).containsExactly(Map.entry("Kvinne", 490000.0d), Map.entry("Mann", 580000.0d));
    }

    @Test
    void medianLiesBetweenMinAndMaxForEveryGroup() {
        Map<String, Object> median = service.execute(AnalysisRequest.of("median_salary", "country")).data();
        Map<String, Object> min = service.execute(AnalysisRequest.of("min_salary", "country")).data();
        Map<String, Object> max = service.execute(AnalysisRequest.of("max_salary", "country")).data();

        assertThat(median.keySet()).isEqualTo(min.keySet());
        median.forEach((group, value) -> {
            double m = ((Number) value).doubleValue();
            assertThat(m).isBetween(((Number) min.get(group)).doubleValue(), ((Number) max.get(group)).doubleValue());
        });
    }

    @Test
    void postAggregationOmitsEmptyBuckets() {
        fixtures.jdbcTemplate().update("UPDATE employees SET salary = NULL WHERE work_country = 'Sverige'");

        AnalysisResult result = service.execute(AnalysisRequest.of("median_salary", "country"));

        assertThat(result.data()).containsOnlyKeys("Danmark", "Norge");
        assertThat(result.meta().totalGroups()).isEqualTo(2);
    }

    @Test
    void postAggregatedTotalWithNoValuesIsEmpty() {
        AnalysisResult result = service.execute(AnalysisRequest.of("median_salary", "all")
                .withFilters(FilterSpec.single("country", "Finland")));

        assertThat(result.data()).isEmpty();
    }

    @Test
    void ordinaryTotalWithNoRowsRendersZero() {
        AnalysisResult result = service.execute(AnalysisRequest.of("avg_salary", "all")
                .withFilters(FilterSpec.single("country", "Finland")));

        assertThat(result.data()).containsExactly(Map.entry("All", 0.0d));
    }

    @Test
    void splitProducesNestedMaps() {
        AnalysisResult result = service.execute(AnalysisRequest.of("count", "country").withSplitBy("gender"));

        assertThat(result.data()).containsOnlyKeys("Danmark", "Norge", "Sverige");
        assertThat(result.data().get("Norge")).isEqualTo(Map.of("Kvinne", 1L, "Mann", 4L));
        assertThat(result.data().get("Sverige")).isEqualTo(Map.of("Kvinne", 1L));
        assertThat(result.meta().splitByLabel()).isEqualTo("Gender");
    }

    @Test
    void totalWithSplitNestsUnderAll() {
        AnalysisResult result = service.execute(AnalysisRequest.of("count", "all").withSplitBy("gender"));

        assertThat(result.data()).containsOnlyKeys("All");
        assertThat(result.data().get("All")).isEqualTo(Map.of("Kvinne", 3L, "Mann", 5L));
    }

    @Test
    void medianWithSplitReducesPerCell() {
        AnalysisResult result = service.execute(AnalysisRequest.of("median_salary", "country").withSplitBy("gender"));

        assertThat(result.data().get("Norge")).isEqualTo(Map.of("Kvinne", 720000.0d, "Mann", 615000.0d));
    }

    @Test
    void groupsByConfiguredAgeBrackets() {
        AnalysisResult result = service.execute(AnalysisRequest.of("count", "age_group"));

        assertThat(result.data())
                .containsExactly(
                        Map.entry("25-34", 2L),
                        Map.entry("35-44", 3L),
                        Map.entry("55-64", 2L),
                        Map.entry("Under 25", 1L));
    }

    @Test
    void ageBracketChangesApplyToNextCall() {
        fixtures.jdbcTemplate().update("INSERT INTO age_brackets (min_age, max_age, label, sort_order) VALUES (NULL, 39, 'Young', 1)");
        fixtures.jdbcTemplate().update("INSERT INTO age_brackets (min_age, max_age, label, sort_order) VALUES (40, NULL, 'Experienced', 2)");

        AnalysisResult result = service.execute(AnalysisRequest.of("count", "age_group"));

        assertThat(result.data()).containsExactly(Map.entry("Experienced", 3L), Map.entry("Young", 5L));
    }

    @Test
    void groupsByTenureAsOfToday() {
        AnalysisResult result = service.execute(AnalysisRequest.of("count", "tenure_group"));

        assertThat(result.data())
                .containsOnly(
                        Map.entry("1-2 years", 1L),
                        Map.entry("2-5 years", 2L),
                        Map.entry("5-10 years", 3L),
                        Map.entry("Over 10 years", 2L));
    }

    @Test
    void tenureIsMeasuredAtSnapshotDate() {
        FilterSpec erik = FilterSpec.single("role", "Konsulent");

        AnalysisResult today = service.execute(AnalysisRequest.of("avg_tenure", "all").withFilters(erik));
        AnalysisResult atSnapshot = service.execute(AnalysisRequest.of("avg_tenure", "all")
                .withFilters(erik)
                .withSnapshotDate(LocalDate.of(2025, 1, 1)));

        assertThat(today.data()).containsEntry("All", 10.8d);
        assertThat(atSnapshot.data()).containsEntry("All", 9.8d);
    }

    @Test
    void futureEndDateDoesNotExtendTenure() {
        AnalysisResult result = service.execute(AnalysisRequest.of("avg_tenure", "all")
                .withFilters(FilterSpec.single("role", "Controller")));

        assertThat(result.data()).containsEntry("All", 16.0d);
    }

    @Test
    void percentageMetricsRoundToOneDecimal() {
        assertThat(service.execute(AnalysisRequest.of("pct_female", "all")).data()).containsEntry("All", 37.5d);
        assertThat(service.execute(AnalysisRequest.of("pct_leaders", "all")).data()).containsEntry("All", 25.0d);
    }

    @Test
    void otherMetricsRoundToWholeValues() {
        assertThat(service.execute(AnalysisRequest.of("avg_salary", "all")).data()).containsEntry("All", 561250.0d);
        assertThat(service.execute(AnalysisRequest.of("sum_salary", "all")).data()).containsEntry("All", 4490000.0d);
        assertThat(service.execute(AnalysisRequest.of("avg_age", "all")).data()).containsEntry("All", 39.0d);
        assertThat(service.execute(AnalysisRequest.of("median_age", "all")).data()).containsEntry("All", 37.0d);
        assertThat(service.execute(AnalysisRequest.of("avg_work_hours", "all")).data()).containsEntry("All", 36.0d);
    }

    @Test
    void nullDimensionValuesGroupAsUnknown() {
        fixtures.jdbcTemplate().update("UPDATE employees SET department = NULL WHERE first_name = 'Sofia'");

        AnalysisResult result = service.execute(AnalysisRequest.of("count", "department"));

        assertThat(result.data()).containsEntry("Unknown", 1L);
    }

    @Test
    void repeatedCallsReturnIdenticalResults() {
        AnalysisRequest request = AnalysisRequest.of("median_salary", "department").withSplitBy("gender");

        assertThat(service.execute(request)).isEqualTo(service.execute(request));
    }

    @Test
    void validationHappensBeforeAnyQuery() {
        fixtures.close();

        assertThatThrownBy(() -> service.execute(AnalysisRequest.of("count", "nope")))
                .isInstanceOf(AnalysisValidationException.class);
    }

    @Test
    void storeFailuresPropagate() {
        fixtures.jdbcTemplate().execute("DROP TABLE employees");

        assertThatThrownBy(() -> service.execute(AnalysisRequest.of("count", "gender")))
                .isInstanceOf(DataAccessException.class);
    }

    private long total(AnalysisRequest request) {
        return (Long) service.execute(request).data().get("All");
    }

    private static long sum(AnalysisResult result) {
        return result.data().values().stream().mapToLong(v -> (Long) v).sum();
    }
}
