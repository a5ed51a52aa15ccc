package com.bmsedge.forecast.dto;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Run headline for history listings.
 */
@Getter
@Setter
public class ForecastRunSummary {
    private Long runId;
    private LocalDate weekStartDate;
    private LocalDateTime createdAt;
    private BigDecimal alpha;
    private Boolean useModel;
    private Integer itemCount;
    private Integer alertCount;
    private Integer totalQuantity;
}
