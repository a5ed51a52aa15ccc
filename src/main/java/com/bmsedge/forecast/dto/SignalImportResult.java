package com.bmsedge.forecast.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class SignalImportResult {
    private String fileName;
    private String signalType;
    private int imported;
    private int replaced;
    private LocalDate minDate;
    private LocalDate maxDate;
    private List<RejectedRow> rejectedRows = new ArrayList<>();
}
