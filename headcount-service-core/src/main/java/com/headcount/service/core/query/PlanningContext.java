package com.headcount.service.core.query;

import com.headcount.service.core.catalog.BucketRule;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Per-call inputs the planner would otherwise have to read from shared state.
 *
 * @param ageBrackets age bucket rule as currently configured
 * @param referenceDate the date tenure is measured up to: the snapshot date if any, otherwise today
 */
public record PlanningContext(BucketRule ageBrackets, LocalDate referenceDate) {

    public PlanningContext {
        Objects.requireNonNull(ageBrackets, "ageBrackets");
        Objects.requireNonNull(referenceDate, "referenceDate");
    }
}
