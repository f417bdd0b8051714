package com.whosly.converter.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.List;

/**
 * What a caller gets back from a run. Details stay in the summary file.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunResult {

    private final RunStatus status;
    private final String message;
    private final String outputDir;
    private final List<FileOutcome> fileResults;
    private final String summaryFilePath;

    public RunResult(RunStatus status, String message, String outputDir, List<FileOutcome> fileResults,
                     String summaryFilePath) {
        this.status = status;
        this.message = message;
        this.outputDir = outputDir;
        this.fileResults = fileResults == null ? Collections.<FileOutcome>emptyList() : fileResults;
        this.summaryFilePath = summaryFilePath;
    }

    public static RunResult error(String message) {
        return new RunResult(RunStatus.ERROR, message, null, null, null);
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    public String getMessage() {
        return message;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public List<FileOutcome> getFileResults() {
        return fileResults;
    }

    public String getSummaryFilePath() {
        return summaryFilePath;
    }

    @Override
    public String toString() {
        return "RunResult{status=" + status.getValue() + ", message=" + message + ", outputDir=" + outputDir
                + ", files=" + fileResults.size() + ", summary=" + summaryFilePath + "}";
    }
}
