package com.bmsedge.forecast.dto;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class ForecastRunResponse {
    private Long runId;
    private LocalDate weekStartDate;
    private BigDecimal alpha;
    private Boolean useModel;
    private LocalDateTime createdAt;
    private Integer totalQuantity;
    private List<ForecastLineResponse> lines = new ArrayList<>();
    private List<ForecastAlertResponse> alerts = new ArrayList<>();
}
