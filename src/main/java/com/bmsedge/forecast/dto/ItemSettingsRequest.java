package com.bmsedge.forecast.dto;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Per-item production settings. Null fields are left unchanged.
 */
@Getter
@Setter
public class ItemSettingsRequest {

    @Min(0)
    private Integer minBatchSize;

    @Min(1)
    private Integer roundingUnit;

    private BigDecimal tempCoefficient;

    private BigDecimal rainCoefficient;

    private Boolean active;
}
