package com.bmsedge.forecast.feed;

import com.bmsedge.forecast.exception.SignalUnavailableException;
import com.bmsedge.forecast.model.AdjustmentSignal;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of holiday and event uplifts for a date.
 */
public interface HolidayFeed {

    List<AdjustmentSignal> get(LocalDate date) throws SignalUnavailableException;
}
