package com.bmsedge.forecast.model;

public enum SignalKind {
    WEATHER,
    HOLIDAY,
    EVENT
}
