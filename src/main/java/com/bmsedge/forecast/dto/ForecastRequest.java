package com.bmsedge.forecast.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
public class ForecastRequest {

    /** Monday of the week to forecast; defaults to the next Monday. */
    private LocalDate weekStart;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double alpha = 0.0;

    private Boolean useModel = true;

    public ForecastRequest() {}

    public ForecastRequest(LocalDate weekStart, Double alpha, Boolean useModel) {
        this.weekStart = weekStart;
        this.alpha = alpha;
        this.useModel = useModel;
    }
}
