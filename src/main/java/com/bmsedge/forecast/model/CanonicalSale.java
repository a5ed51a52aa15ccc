package com.bmsedge.forecast.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Item-resolved sale handed to the sales store.
 */
@Value
public class CanonicalSale {
    LocalDate date;
    Long itemId;
    BigDecimal quantity;
    String sourceRowRef;
}
