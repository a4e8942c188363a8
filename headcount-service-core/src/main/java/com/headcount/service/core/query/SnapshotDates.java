package com.headcount.service.core.query;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

public final class SnapshotDates {

    public static final String FIELD = "snapshotDate";

    private SnapshotDates() {}

    /** Parses an ISO {@code yyyy-MM-dd} date; blank input means no snapshot. */
    public static LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new AnalysisValidationException(
                    FIELD, raw, "Invalid snapshotDate '" + raw + "'; expected a calendar date as yyyy-MM-dd");
        }
    }
}
