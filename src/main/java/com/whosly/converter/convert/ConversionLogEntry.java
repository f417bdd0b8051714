package com.whosly.converter.convert;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One immutable log line of a statement's conversion.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConversionLogEntry {

    private final ConversionAction action;
    private final String details;
    private final String file;
    private final int line;

    public ConversionLogEntry(ConversionAction action, String details, String file, int line) {
        this.action = action;
        this.details = details;
        this.file = file;
        this.line = line;
    }

    public ConversionAction getAction() {
        return action;
    }

    public String getDetails() {
        return details;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public boolean isError() {
        return action.isError();
    }

    @Override
    public String toString() {
        return action.getTag() + " [" + file + ":" + line + "] " + details;
    }
}
