package com.whosly.converter.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whosly.converter.convert.ConversionLogEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Full result of one input file, as written to the run summary.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FileResult {

    private final String fileName;
    private FileStatus status;
    private String outputPath;
    private String message;
    private int statementsConverted;
    private int statementsSkipped;
    private int statementsWithErrors;
    private final List<ConversionLogEntry> logs = new ArrayList<>();
    private final List<String> statements = new ArrayList<>();

    public FileResult(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    public FileStatus getStatus() {
        return status;
    }

    public void setStatus(FileStatus status) {
        this.status = status;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public int getStatementsConverted() {
        return statementsConverted;
    }

    public int getStatementsSkipped() {
        return statementsSkipped;
    }

    public int getStatementsWithErrors() {
        return statementsWithErrors;
    }

    public List<ConversionLogEntry> getLogs() {
        return Collections.unmodifiableList(logs);
    }

    /**
     * Converted target statements, without terminators. Not serialized.
     */
    @JsonIgnore
    public List<String> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    void addLog(ConversionLogEntry entry) {
        logs.add(entry);
    }

    void addLogs(List<ConversionLogEntry> entries) {
        logs.addAll(entries);
    }

    void addStatements(List<String> converted) {
        statements.addAll(converted);
    }

    void countConverted() {
        statementsConverted++;
    }

    void countSkipped() {
        statementsSkipped++;
    }

    void countWithErrors() {
        statementsWithErrors++;
    }

    @Override
    public String toString() {
        return "FileResult{" + fileName + ", " + status + ", converted=" + statementsConverted
                + ", skipped=" + statementsSkipped + ", errors=" + statementsWithErrors + "}";
    }
}
