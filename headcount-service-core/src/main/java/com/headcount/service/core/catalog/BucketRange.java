package com.headcount.service.core.catalog;

import java.util.Objects;

/**
 * One interval of a bucket rule. A {@code null} bound is open on that side; the lower bound is always
 * inclusive.
 */
public record BucketRange(Double min, Double max, boolean maxInclusive, String label) {

    public BucketRange {
        Objects.requireNonNull(label, "label");
        if (min == null && max == null) {
            throw new IllegalArgumentException("bucket '" + label + "' has no bounds");
        }
    }

    /** Closed interval {@code [min, max]}, as used by the configurable age brackets. */
    public static BucketRange closed(Integer min, Integer max, String label) {
        return new BucketRange(min == null ? null : min.doubleValue(), max == null ? null : max.doubleValue(), true, label);
    }

    /** Half-open interval {@code [min, max)}. */
    public static BucketRange halfOpen(Double min, Double max, String label) {
        return new BucketRange(min, max, false, label);
    }
}
