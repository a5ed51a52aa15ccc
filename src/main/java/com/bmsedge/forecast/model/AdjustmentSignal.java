package com.bmsedge.forecast.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Read-only multiplicative input for one date.
 */
@Value
public class AdjustmentSignal {
    LocalDate date;
    SignalKind kind;
    String label;
    double multiplier;
    /** Confidence in {@code multiplier}, 0..1. */
    double weight;

    public double effectiveMultiplier() {
        return 1.0 + weight * (multiplier - 1.0);
    }
}
