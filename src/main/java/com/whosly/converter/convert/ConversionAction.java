package com.whosly.converter.convert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Tag of a conversion log entry.
 */
public enum ConversionAction {
    TRANSPILE_FALLBACK(false),
    RECOVERY_REPARSE(false),
    UNPARSED_FALLBACK(true),
    REMOVE_REPLACE(false),
    TYPE_CONVERSION_ERROR(true),
    VIRTUAL_COLUMN(false),
    PROPERTY_REMOVED(false),
    CLAUSE_REMOVED(false),
    SKIPPED(false),
    ERROR(true);

    private final boolean error;

    ConversionAction(boolean error) {
        this.error = error;
    }

    public boolean isError() {
        return error;
    }

    @JsonValue
    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
