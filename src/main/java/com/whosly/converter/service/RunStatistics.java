package com.whosly.converter.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunStatistics {

    private int filesProcessed;
    private int filesConverted;
    private int filesSkipped;
    private int filesFailed;
    private int statementsConverted;
    private int statementsSkipped;
    private int statementsWithErrors;

    public static RunStatistics of(List<FileResult> results) {
        RunStatistics stats = new RunStatistics();
        for (FileResult result : results) {
            stats.filesProcessed++;
            switch (result.getStatus()) {
                case SUCCESS:
                case PARTIAL:
                    stats.filesConverted++;
                    break;
                case SKIPPED:
                    stats.filesSkipped++;
                    break;
                default:
                    stats.filesFailed++;
                    break;
            }
            stats.statementsConverted += result.getStatementsConverted();
            stats.statementsSkipped += result.getStatementsSkipped();
            stats.statementsWithErrors += result.getStatementsWithErrors();
        }
        return stats;
    }

    public int getFilesProcessed() {
        return filesProcessed;
    }

    public int getFilesConverted() {
        return filesConverted;
    }

    public int getFilesSkipped() {
        return filesSkipped;
    }

    public int getFilesFailed() {
        return filesFailed;
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

    @Override
    public String toString() {
        return "files processed=" + filesProcessed + ", converted=" + filesConverted + ", skipped=" + filesSkipped
                + ", failed=" + filesFailed + "; statements converted=" + statementsConverted
                + ", skipped=" + statementsSkipped + ", with errors=" + statementsWithErrors;
    }
}
