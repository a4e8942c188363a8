package com.headcount.service.core.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** In-memory reductions for statistics the relational engine cannot push down. */
public enum Reducer {
    MEDIAN {
        @Override
        public double reduce(List<Double> values) {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("median of an empty bucket is undefined");
            }
            List<Double> sorted = new ArrayList<>(values);
            Collections.sort(sorted);
            int n = sorted.size();
            int mid = n / 2;
            if (n % 2 == 1) {
                return sorted.get(mid);
            }
            return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0d;
        }
    };

    /** Reduces a non-empty list of non-null values. */
    public abstract double reduce(List<Double> values);
}
