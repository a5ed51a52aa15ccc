package com.bmsedge.forecast.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Header row plus string cells of an uploaded export, independent of file format.
 */
public class RawTable {

    private final String sourceName;
    private final List<String> headers;
    private final List<RawRow> rows;

    public RawTable(String sourceName, List<String> headers, List<RawRow> rows) {
        this.sourceName = sourceName;
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<RawRow> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public static class RawRow {
        private final int rowNumber;
        private final List<String> cells;

        public RawRow(int rowNumber, List<String> cells) {
            this.rowNumber = rowNumber;
            this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
        }

        /** 1-based row number as shown in the source file. */
        public int getRowNumber() {
            return rowNumber;
        }

        public String get(int columnIndex) {
            if (columnIndex < 0 || columnIndex >= cells.size()) {
                return "";
            }
            String value = cells.get(columnIndex);
            return value == null ? "" : value.trim();
        }

        public boolean isBlank() {
            return cells.stream().allMatch(c -> c == null || c.trim().isEmpty());
        }
    }
}
