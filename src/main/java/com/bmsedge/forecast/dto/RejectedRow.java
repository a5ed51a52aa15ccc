package com.bmsedge.forecast.dto;

import lombok.Getter;

/**
 * A source row that was not ingested, with the reason shown to the operator.
 */
@Getter
public class RejectedRow {

    private final String sourceRowRef;
    private final String itemName;
    private final String reason;

    public RejectedRow(String sourceRowRef, String itemName, String reason) {
        this.sourceRowRef = sourceRowRef;
        this.itemName = itemName;
        this.reason = reason;
    }

    @Override
    public String toString() {
        return sourceRowRef + ": " + reason;
    }
}
