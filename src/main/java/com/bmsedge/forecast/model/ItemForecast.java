package com.bmsedge.forecast.model;

import lombok.Value;

import java.util.List;

/**
 * One item's finished week: the line to record and the alerts raised while computing it.
 */
@Value
public class ItemForecast {
    ForecastLine line;
    List<ForecastAlert> alerts;
}
