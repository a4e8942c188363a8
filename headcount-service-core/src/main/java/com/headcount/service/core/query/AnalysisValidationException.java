package com.headcount.service.core.query;

import java.util.List;

public class AnalysisValidationException extends IllegalArgumentException {
    private final String field;
    private final String rejectedValue;
    private final List<String> allowed;

    public AnalysisValidationException(String field, String rejectedValue, List<String> allowed) {
        super("Invalid " + field + " '" + rejectedValue + "'" + describeAllowed(allowed));
        this.field = field;
        this.rejectedValue = rejectedValue;
        this.allowed = allowed == null ? List.of() : List.copyOf(allowed);
    }

    public AnalysisValidationException(String field, String rejectedValue, String message) {
        super(message);
        this.field = field;
        this.rejectedValue = rejectedValue;
        this.allowed = List.of();
    }

    private static String describeAllowed(List<String> allowed) {
        if (allowed == null || allowed.isEmpty()) return "";
        return "; allowed values: " + String.join(", ", allowed);
    }

    public String field() {
        return field;
    }

    public String rejectedValue() {
        return rejectedValue;
    }

    public List<String> allowed() {
        return allowed;
    }
}
