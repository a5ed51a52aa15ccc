package com.bmsedge.forecast.dto;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
public class TrainResult {

    private final Long itemId;
    private final String itemName;
    private final TrainStatus status;
    private final int trainingSamples;
    private final Double crossValError;
    private final boolean lowConfidence;
    private final Integer version;
    private final LocalDateTime trainedAt;
    private final String message;

    public boolean isTrained() {
        return status == TrainStatus.TRAINED;
    }
}
