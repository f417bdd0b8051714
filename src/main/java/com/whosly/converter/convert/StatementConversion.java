package com.whosly.converter.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of converting one source statement: zero or more target statements plus their logs.
 */
public class StatementConversion {

    private final List<String> statements;
    private final List<ConversionLogEntry> logs;

    public StatementConversion(List<String> statements, List<ConversionLogEntry> logs) {
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.logs = Collections.unmodifiableList(new ArrayList<>(logs));
    }

    public List<String> getStatements() {
        return statements;
    }

    public List<ConversionLogEntry> getLogs() {
        return logs;
    }

    public boolean hasErrors() {
        for (ConversionLogEntry entry : logs) {
            if (entry.isError()) {
                return true;
            }
        }
        return false;
    }

    public StatementConversion withLeadingLog(ConversionLogEntry entry) {
        List<ConversionLogEntry> merged = new ArrayList<>();
        merged.add(entry);
        merged.addAll(logs);
        return new StatementConversion(statements, merged);
    }
}
