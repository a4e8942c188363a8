package com.headcount.service.core.catalog;

import java.util.List;
import java.util.Objects;

/**
 * A whitelisted grouping attribute: either a stored column or a bucketed value computed at query time.
 */
public record DimensionDefinition(
        String id, String label, String column, BucketKind bucket, List<String> guardColumns) {

    public DimensionDefinition {
        Objects.requireNonNull(id, "id");
        if ((column == null) == (bucket == null)) {
            throw new IllegalArgumentException("dimension " + id + " needs exactly one of column or bucket");
        }
        guardColumns = guardColumns == null ? List.of() : List.copyOf(guardColumns);
    }

    public static DimensionDefinition column(String id, String label, String column) {
        return new DimensionDefinition(id, label, column, null, List.of());
    }

    public static DimensionDefinition bucketed(String id, String label, BucketKind bucket, String guardColumn) {
        return new DimensionDefinition(id, label, null, bucket, List.of(guardColumn));
    }

    public boolean computed() {
        return bucket != null;
    }

    /** Only column-backed dimensions can be filtered on. */
    public boolean filterable() {
        return column != null;
    }
}
