package org.rostilos.difflens.diff.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LineType {
    CONTEXT("context", ' '),
    ADDED("added", '+'),
    DELETED("deleted", '-');

    private final String value;
    private final char marker;

    LineType(String value, char marker) {
        this.value = value;
        this.marker = marker;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Prefix character the line carries in a unified diff body.
     */
    public char getMarker() {
        return marker;
    }
}
