package com.headcount.service.core.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Filter dimension id to the values it must match (any of). Dimensions with no values are dropped on
 * construction, so an empty selection never narrows the population.
 */
public record FilterSpec(Map<String, List<String>> entries) {

    private static final FilterSpec EMPTY = new FilterSpec(Map.of());

    public FilterSpec {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (entries != null) {
            entries.forEach((key, values) -> {
                if (key == null || values == null) return;
                List<String> kept = values.stream().filter(Objects::nonNull).toList();
                if (!kept.isEmpty()) copy.put(key, kept);
            });
        }
        entries = Collections.unmodifiableMap(copy);
    }

    public static FilterSpec empty() {
        return EMPTY;
    }

    public static FilterSpec of(Map<String, ? extends Collection<String>> filters) {
        if (filters == null || filters.isEmpty()) return EMPTY;
        Map<String, List<String>> converted = new LinkedHashMap<>();
        filters.forEach((k, v) -> converted.put(k, v == null ? null : new ArrayList<>(v)));
        return new FilterSpec(converted);
    }

    public static FilterSpec single(String dimension, String... values) {
        return new FilterSpec(Map.of(dimension, List.of(values)));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
