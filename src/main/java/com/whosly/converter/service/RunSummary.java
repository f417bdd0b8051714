package com.whosly.converter.service;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whosly.converter.convert.ConversionLogEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Content of {@code conversion_summary.json}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"overallStatistics", "files", "conversionLogs", "outputDirectory", "cleanupScript",
        "manualReviewReport"})
public class RunSummary {

    private final RunStatistics overallStatistics;
    private final List<FileResult> files;
    private final List<ConversionLogEntry> conversionLogs;
    private final String outputDirectory;
    private final String cleanupScript;
    private final String manualReviewReport;

    public RunSummary(RunStatistics overallStatistics, List<FileResult> files, String outputDirectory,
                      String cleanupScript, String manualReviewReport) {
        this.overallStatistics = overallStatistics;
        this.files = files;
        this.conversionLogs = new ArrayList<>();
        for (FileResult file : files) {
            conversionLogs.addAll(file.getLogs());
        }
        this.outputDirectory = outputDirectory;
        this.cleanupScript = cleanupScript;
        this.manualReviewReport = manualReviewReport;
    }

    public RunStatistics getOverallStatistics() {
        return overallStatistics;
    }

    public List<FileResult> getFiles() {
        return files;
    }

    public List<ConversionLogEntry> getConversionLogs() {
        return conversionLogs;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public String getCleanupScript() {
        return cleanupScript;
    }

    public String getManualReviewReport() {
        return manualReviewReport;
    }
}
