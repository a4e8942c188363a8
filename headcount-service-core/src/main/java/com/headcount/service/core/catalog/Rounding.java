package com.headcount.service.core.catalog;

import java.math.BigDecimal;
import java.math.RoundingMode;

public enum Rounding {
    /** Counts: rendered as a long. */
    WHOLE_NUMBER,
    /** Percentages and durations in years. */
    ONE_DECIMAL,
    ZERO_DECIMALS;

    /** Rounds a raw aggregate; {@code null} renders as zero. */
    public Number apply(Number raw) {
        if (this == WHOLE_NUMBER) {
            if (raw == null) return 0L;
            return toDecimal(raw).setScale(0, RoundingMode.HALF_UP).longValue();
        }
        if (raw == null) return 0.0d;
        int scale = this == ONE_DECIMAL ? 1 : 0;
        return toDecimal(raw).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static BigDecimal toDecimal(Number raw) {
        if (raw instanceof BigDecimal bd) return bd;
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short) {
            return BigDecimal.valueOf(raw.longValue());
        }
        return BigDecimal.valueOf(raw.doubleValue());
    }
}
