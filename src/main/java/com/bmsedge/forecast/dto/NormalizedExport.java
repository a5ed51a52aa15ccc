package com.bmsedge.forecast.dto;

import com.bmsedge.forecast.model.ExportLayout;
import com.bmsedge.forecast.model.TidySaleRow;
import lombok.Getter;

import java.util.List;

@Getter
public class NormalizedExport {

    private final ExportLayout layout;
    private final List<TidySaleRow> rows;
    private final List<RejectedRow> rejectedRows;
    /** Total and subtotal lines of the export, left out of the sales. */
    private final List<RejectedRow> skippedRows;

    public NormalizedExport(ExportLayout layout, List<TidySaleRow> rows, List<RejectedRow> rejectedRows) {
        this(layout, rows, rejectedRows, List.of());
    }

    public NormalizedExport(ExportLayout layout, List<TidySaleRow> rows, List<RejectedRow> rejectedRows,
                            List<RejectedRow> skippedRows) {
        this.layout = layout;
        this.rows = List.copyOf(rows);
        this.rejectedRows = List.copyOf(rejectedRows);
        this.skippedRows = List.copyOf(skippedRows);
    }
}
