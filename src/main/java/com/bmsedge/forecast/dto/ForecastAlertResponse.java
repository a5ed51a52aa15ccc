package com.bmsedge.forecast.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
public class ForecastAlertResponse {
    private Long itemId;
    private String itemName;
    private LocalDate forecastDate;
    private String reason;
    private String detail;
}
