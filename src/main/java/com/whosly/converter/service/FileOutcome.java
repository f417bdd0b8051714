package com.whosly.converter.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-file entry of the slim {@link RunResult}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FileOutcome {

    private final String fileName;
    private final FileStatus status;
    private final String message;

    public FileOutcome(String fileName, FileStatus status, String message) {
        this.fileName = fileName;
        this.status = status;
        this.message = message;
    }

    static FileOutcome of(FileResult result) {
        return new FileOutcome(result.getFileName(), result.getStatus(), result.getMessage());
    }

    public String getFileName() {
        return fileName;
    }

    public FileStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
