package com.bmsedge.forecast.exception;

import java.util.List;

/**
 * A raw item name matched two or more existing items equally well.
 */
public class ResolutionAmbiguityException extends RuntimeException {

    private final String rawName;
    private final List<String> candidates;

    public ResolutionAmbiguityException(String rawName, List<String> candidates) {
        super("Item name '" + rawName + "' matches several items equally well: " + candidates);
        this.rawName = rawName;
        this.candidates = List.copyOf(candidates);
    }

    public String getRawName() {
        return rawName;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
