package com.bmsedge.forecast.exception;

import java.util.Collections;
import java.util.List;

/**
 * A sales export whose mandatory columns could not be identified. The whole file is rejected.
 */
public class SchemaException extends BusinessException {

    private final List<String> missingColumns;
    private final List<String> detectedHeaders;

    public SchemaException(List<String> missingColumns, List<String> detectedHeaders) {
        super("Missing required columns after header matching: " + missingColumns
                + " (detected headers: " + detectedHeaders + ")");
        this.missingColumns = List.copyOf(missingColumns);
        this.detectedHeaders = List.copyOf(detectedHeaders);
    }

    public SchemaException(String message) {
        super(message);
        this.missingColumns = Collections.emptyList();
        this.detectedHeaders = Collections.emptyList();
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }

    public List<String> getDetectedHeaders() {
        return detectedHeaders;
    }
}
