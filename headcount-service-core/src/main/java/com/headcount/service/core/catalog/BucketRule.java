package com.headcount.service.core.catalog;

import java.util.Comparator;
import java.util.List;

/**
 * Ordered intervals mapping a numeric value to a label. Overlap is not checked here: rules are
 * trusted as read from configuration.
 */
public record BucketRule(BucketKind kind, List<BucketRange> ranges) {

    private static final Comparator<BucketRange> ASCENDING = Comparator.comparing(
                    BucketRange::min, Comparator.nullsFirst(Comparator.<Double>naturalOrder()))
            .thenComparing(BucketRange::max, Comparator.nullsLast(Comparator.<Double>naturalOrder()));

    public BucketRule {
        ranges = ranges == null ? List.of() : List.copyOf(ranges);
    }

    /** Ranges in ascending boundary order, the order the CASE expression evaluates them in. */
    public List<BucketRange> ascending() {
        return ranges.stream().sorted(ASCENDING).toList();
    }

    public List<String> labels() {
        return ascending().stream().map(BucketRange::label).toList();
    }
}
