package org.mides.pooling.model;

import lombok.Value;

/**
 * Arrival times and loads computed for a stop sequence, index-aligned with
 * the sequence it was computed for.
 */
@Value
public class Schedule {
    long[] arrivals;
    int[] loads;

    public long duration() {
        return arrivals.length == 0 ? 0 : arrivals[arrivals.length - 1] - arrivals[0];
    }
}
