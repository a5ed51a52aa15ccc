package com.bmsedge.forecast.feed;

import com.bmsedge.forecast.exception.SignalUnavailableException;
import com.bmsedge.forecast.model.WeatherConditions;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of daily weather for a location. An empty result means nothing is known for the date.
 */
public interface WeatherFeed {

    Optional<WeatherConditions> get(LocalDate date, String location) throws SignalUnavailableException;
}
