package com.httpcache.model;

import java.time.Instant;

/**
 * Numeric fields the indexed store can be range-queried on, both in seconds.
 */
public enum RangeField {
    AGE,
    TIME_TO_LIVE;

    public long valueAt(FreshnessPolicy policy, Instant now) {
        return switch (this) {
            case AGE -> policy.ageAt(now);
            case TIME_TO_LIVE -> policy.timeToLiveAt(now);
        };
    }

    /**
     * Parse "age", "time_to_live" or "time-to-live", ignoring case.
     */
    public static RangeField parse(String value) {
        return RangeField.valueOf(value.trim().replace('-', '_').toUpperCase());
    }
}
