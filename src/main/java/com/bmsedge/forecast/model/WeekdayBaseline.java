package com.bmsedge.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

/**
 * Recency-weighted expectation for one item on one weekday. Derived per run, never stored.
 */
@Value
@Builder
public class WeekdayBaseline {
    Long itemId;
    DayOfWeek weekday;
    double estimatedMean;
    /** Sum of decay weights of the weekday instances used. */
    double sampleWeight;
    int instanceCount;
    /** True when the weekday had a single instance and the weekday-agnostic mean was used. */
    boolean fallback;
    /** Unweighted mean of the same instances. */
    double historicalMean;
    /** Sample standard deviation of the same instances, 0 with fewer than two. */
    double historicalStdDev;
    LocalDateTime lastUpdated;

    public boolean isColdStart() {
        return instanceCount == 0;
    }
}
