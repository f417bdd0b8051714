package com.whosly.converter.review;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One conversion item the pipeline could not resolve on its own.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ManualReviewItem {

    public static final String PENDING_REVIEW = "PENDING_REVIEW";

    private final String timestamp;
    private final String filePath;
    private final String objectName;
    private final String objectType;
    private final String issueType;
    private final ReviewSeverity severity;
    private final String message;
    private final String suggestedAction;
    private final Integer lineNumber;
    private final String status;

    public ManualReviewItem(String timestamp, String filePath, String objectName, String objectType,
                            String issueType, ReviewSeverity severity, String message,
                            String suggestedAction, Integer lineNumber) {
        this.timestamp = timestamp;
        this.filePath = filePath;
        this.objectName = objectName;
        this.objectType = objectType;
        this.issueType = issueType;
        this.severity = severity;
        this.message = message;
        this.suggestedAction = suggestedAction;
        this.lineNumber = lineNumber;
        this.status = PENDING_REVIEW;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getFilePath() {
        return filePath;
    }

    public String getObjectName() {
        return objectName;
    }

    public String getObjectType() {
        return objectType;
    }

    public String getIssueType() {
        return issueType;
    }

    public ReviewSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public String getSuggestedAction() {
        return suggestedAction;
    }

    public Integer getLineNumber() {
        return lineNumber;
    }

    public String getStatus() {
        return status;
    }
}
