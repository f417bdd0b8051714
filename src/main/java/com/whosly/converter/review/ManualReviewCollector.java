package com.whosly.converter.review;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Shared sink for manual-review items of one run. Safe to use from several worker threads.
 */
public class ManualReviewCollector {

    private static final Logger log = LoggerFactory.getLogger(ManualReviewCollector.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path outputDir;
    private final ObjectMapper objectMapper;
    private final List<ManualReviewItem> items = new ArrayList<>();
    private Path reportPath;

    public ManualReviewCollector(Path outputDir, ObjectMapper objectMapper) {
        this.outputDir = outputDir;
        this.objectMapper = objectMapper;
    }

    /**
     * Record an item of a known pattern, using the pattern's severity and suggested action.
     */
    public void record(ReviewPattern pattern, String filePath, String objectName, String objectType,
                       String message, Integer lineNumber) {
        record(filePath, objectName, objectType, pattern.name(), message, pattern.getSeverity(),
                pattern.getSuggestedAction(), lineNumber);
    }

    /**
     * Record an item. Never throws.
     *
     * @param objectType object type if known, otherwise null to infer it from the object name
     */
    public void record(String filePath, String objectName, String objectType, String issueType, String message,
                       ReviewSeverity severity, String suggestedAction, Integer lineNumber) {
        try {
            String name = objectName == null ? "UNKNOWN" : objectName;
            ManualReviewItem item = new ManualReviewItem(LocalDateTime.now().toString(), filePath, name,
                    objectType != null ? objectType : detectObjectType(name), issueType,
                    severity == null ? ReviewSeverity.WARNING : severity, message, suggestedAction, lineNumber);
            synchronized (this) {
                items.add(item);
            }
            String logMessage = "MANUAL REVIEW [{}] {}::{} - {}: {}";
            if (item.getSeverity() == ReviewSeverity.ERROR) {
                log.error(logMessage, item.getSeverity(), filePath, name, issueType, message);
            } else {
                log.warn(logMessage, item.getSeverity(), filePath, name, issueType, message);
            }
        } catch (RuntimeException e) {
            log.error("Failed to record manual review item {} for {}", issueType, filePath, e);
        }
    }

    static String detectObjectType(String objectName) {
        String lower = objectName.toLowerCase(Locale.ROOT);
        if (lower.contains("function") || lower.contains("func")) {
            return "FUNCTION";
        }
        if (lower.contains("procedure") || lower.contains("proc")) {
            return "PROCEDURE";
        }
        if (lower.contains("table") || lower.contains("tbl")) {
            return "TABLE";
        }
        if (lower.contains("view")) {
            return "VIEW";
        }
        return "UNKNOWN";
    }

    public synchronized List<ManualReviewItem> getItems() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized Map<String, Long> countBySeverity() {
        return count(item -> item.getSeverity().name(), false);
    }

    public synchronized Map<String, Long> countByType() {
        return count(ManualReviewItem::getIssueType, true);
    }

    public synchronized Map<String, Long> countByFile() {
        return count(ManualReviewItem::getFilePath, true);
    }

    private Map<String, Long> count(Function<ManualReviewItem, String> key, boolean descending) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ManualReviewItem item : items) {
            counts.merge(String.valueOf(key.apply(item)), 1L, Long::sum);
        }
        if (!descending) {
            return counts;
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort((a, b) -> Long.compare(b.getValue(), a.getValue()));
        Map<String, Long> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }

    /**
     * Write the report if anything was recorded. Calling it again returns the same file.
     *
     * @return the report path, or null when there was nothing to report or writing failed
     */
    public synchronized Path flush() {
        if (reportPath != null) {
            return reportPath;
        }
        if (items.isEmpty()) {
            return null;
        }
        String timestamp = LocalDateTime.now().format(FILE_TIMESTAMP);
        Path target = outputDir.resolve("manual_review_required_" + timestamp + ".json");
        ManualReviewReport report = new ManualReviewReport(timestamp, countBySeverity(), countByType(),
                countByFile(), new ArrayList<>(items));
        try {
            Files.createDirectories(outputDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        } catch (IOException e) {
            log.error("Error writing manual review log {}", target, e);
            return null;
        }
        reportPath = target;
        log.info("Manual review log written to: {}", target);
        log.info("Total items requiring manual review: {}", items.size());
        return reportPath;
    }

    /**
     * @return a plain-text summary of the recorded items
     */
    public synchronized String summaryText() {
        if (items.isEmpty()) {
            return "No manual review items found.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("MANUAL REVIEW REQUIRED - CONVERSION SUMMARY\n");
        sb.append("Total Items Requiring Review: ").append(items.size()).append('\n');
        appendSection(sb, "BY SEVERITY:", countBySeverity());
        appendSection(sb, "BY ISSUE TYPE:", countByType());
        appendSection(sb, "BY FILE:", countByFile());
        boolean headerWritten = false;
        for (ManualReviewItem item : items) {
            if (item.getSeverity() != ReviewSeverity.ERROR) {
                continue;
            }
            if (!headerWritten) {
                sb.append("HIGH PRIORITY ITEMS (ERRORS):\n");
                headerWritten = true;
            }
            sb.append("  - ").append(item.getFilePath()).append("::").append(item.getObjectName())
                    .append(" - ").append(item.getMessage()).append('\n');
        }
        if (reportPath != null) {
            sb.append("Detailed log available at: ").append(reportPath).append('\n');
        }
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String title, Map<String, Long> counts) {
        sb.append(title).append('\n');
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            sb.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append(" items\n");
        }
    }
}
