package com.bmsedge.forecast.dto;

import com.bmsedge.forecast.model.ExportLayout;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class IngestResult {

    private Long batchId;
    private String fileName;
    private ExportLayout layout;
    /** Tidy rows (after duplicate aggregation) that reached the store. */
    private int accepted;
    private int recordsWritten;
    private int itemsCreated;
    private LocalDate minDate;
    private LocalDate maxDate;
    private List<RejectedRow> rejectedRows = new ArrayList<>();
    private List<RejectedRow> skippedRows = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
    private List<TrainResult> trainResults = new ArrayList<>();

    public int getRejected() {
        return rejectedRows.size();
    }

    public int getSkipped() {
        return skippedRows.size();
    }
}
