package com.bmsedge.forecast.model;

/**
 * Shape of a raw sales export.
 */
public enum ExportLayout {
    /** One row per item per date. */
    TALL,
    /** One row per item, one column per date. */
    WIDE
}
