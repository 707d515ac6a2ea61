package org.rostilos.difflens.diff.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of change a file section describes.
 */
public enum FileStatus {
    ADDED("added"),
    DELETED("deleted"),
    MODIFIED("modified"),
    RENAMED("renamed");

    private final String value;

    FileStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
