package com.bmsedge.forecast.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Clamped combined multiplier for one item on one forecast date, with a note per contributing signal.
 */
@Value
public class DayAdjustment {
    LocalDate date;
    double multiplier;
    List<String> notes;

    public static DayAdjustment neutral(LocalDate date) {
        return new DayAdjustment(date, 1.0, List.of());
    }
}
