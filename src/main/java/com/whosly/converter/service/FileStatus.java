package com.whosly.converter.service;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of converting one input file.
 */
public enum FileStatus {
    /** output written, no statement failed */
    SUCCESS,
    /** output written, at least one statement logged an error */
    PARTIAL,
    ERROR,
    SKIPPED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
