package com.bmsedge.forecast.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Calendar helpers for the Mon..Sat operating week.
 */
public final class ForecastWeek {

    public static final List<DayOfWeek> OPERATING_DAYS = Collections.unmodifiableList(List.of(
            DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY,
            DayOfWeek.THURSDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY));

    private static final Set<DayOfWeek> OPERATING_SET = EnumSet.copyOf(OPERATING_DAYS);

    private ForecastWeek() {}

    public static boolean isOperatingDay(LocalDate date) {
        return OPERATING_SET.contains(date.getDayOfWeek());
    }

    /** The Monday on or after {@code today}. */
    public static LocalDate nextMonday(LocalDate today) {
        return today.with(TemporalAdjusters.nextOrSame(DayOfWeek.MONDAY));
    }

    public static List<LocalDate> operatingDates(LocalDate weekStart) {
        if (weekStart.getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new IllegalArgumentException("Week start must be a Monday: " + weekStart);
        }
        List<LocalDate> dates = new ArrayList<>(6);
        for (int i = 0; i < OPERATING_DAYS.size(); i++) {
            dates.add(weekStart.plusDays(i));
        }
        return dates;
    }
}
