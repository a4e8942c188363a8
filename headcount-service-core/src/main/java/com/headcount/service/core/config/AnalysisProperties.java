package com.headcount.service.core.config;

import com.headcount.service.core.catalog.BucketRange;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "headcount.analysis")
public class AnalysisProperties {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private String employeeTable = "employees";
    private String ageBracketTable = "age_brackets";
    private List<AgeBracket> defaultAgeBrackets = defaultBrackets();

    /** Table names end up verbatim in SQL, so only plain identifiers are accepted. */
    @PostConstruct
    public void validate() {
        requireIdentifier("headcount.analysis.employee-table", employeeTable);
        requireIdentifier("headcount.analysis.age-bracket-table", ageBracketTable);
        if (defaultAgeBrackets == null || defaultAgeBrackets.isEmpty()) {
            throw new IllegalStateException("headcount.analysis.default-age-brackets must not be empty");
        }
    }

    private static void requireIdentifier(String property, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalStateException(property + " is not a valid SQL identifier: " + value);
        }
    }

    public List<BucketRange> defaultAgeRanges() {
        return defaultAgeBrackets.stream()
                .map(b -> BucketRange.closed(b.getMin(), b.getMax(), b.getLabel()))
                .toList();
    }

    public String getEmployeeTable() {
        return employeeTable;
    }

    public void setEmployeeTable(String employeeTable) {
        this.employeeTable = employeeTable;
    }

    public String getAgeBracketTable() {
        return ageBracketTable;
    }

    public void setAgeBracketTable(String ageBracketTable) {
        this.ageBracketTable = ageBracketTable;
    }

    public List<AgeBracket> getDefaultAgeBrackets() {
        return defaultAgeBrackets;
    }

    public void setDefaultAgeBrackets(List<AgeBracket> defaultAgeBrackets) {
        this.defaultAgeBrackets = defaultAgeBrackets;
    }

    private static List<AgeBracket> defaultBrackets() {
        List<AgeBracket> brackets = new ArrayList<>();
        brackets.add(new AgeBracket(null, 24, "Under 25"));
        brackets.add(new AgeBracket(25, 34, "25-34"));
        brackets.add(new AgeBracket(35, 44, "35-44"));
        brackets.add(new AgeBracket(45, 54, "45-54"));
        brackets.add(new AgeBracket(55, 64, "55-64"));
        brackets.add(new AgeBracket(65, null, "65+"));
        return brackets;
    }

    public static class AgeBracket {
        private Integer min;
        private Integer max;
        private String label;

        public AgeBracket() {}

        public AgeBracket(Integer min, Integer max, String label) {
            this.min = min;
            this.max = max;
            this.label = label;
        }

        public Integer getMin() {
            return min;
        }

        public void setMin(Integer min) {
            this.min = min;
        }

        public Integer getMax() {
            return max;
        }

        public void setMax(Integer max) {
            this.max = max;
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }
    }
}
