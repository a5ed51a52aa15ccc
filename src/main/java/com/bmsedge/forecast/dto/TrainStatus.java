package com.bmsedge.forecast.dto;

public enum TrainStatus {
    TRAINED,
    INSUFFICIENT_HISTORY,
    FAILED
}
