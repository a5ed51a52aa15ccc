package com.bmsedge.forecast.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Value
public class WeatherConditions {
    LocalDate date;
    Double maxTemp;
    Double precipitation;
    LocalDateTime recordedAt;
}
