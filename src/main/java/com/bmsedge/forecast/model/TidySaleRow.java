package com.bmsedge.forecast.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Normalized export row before item resolution. Quantity is negative for refunds.
 */
@Value
public class TidySaleRow {
    LocalDate date;
    String itemNameRaw;
    BigDecimal quantity;
    boolean refund;
    String sourceRowRef;
}
