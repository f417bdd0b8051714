package com.whosly.converter.review;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content of {@code manual_review_required_<timestamp>.json}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ManualReviewReport {

    private final String conversionTimestamp;
    private final int totalItemsRequiringReview;
    private final Map<String, Long> summaryBySeverity;
    private final Map<String, Long> summaryByType;
    private final Map<String, Long> summaryByFile;
    private final List<ManualReviewItem> reviewItems;
    private final Map<String, Object> instructions;

    public ManualReviewReport(String conversionTimestamp, Map<String, Long> summaryBySeverity,
                              Map<String, Long> summaryByType, Map<String, Long> summaryByFile,
                              List<ManualReviewItem> reviewItems) {
        this.conversionTimestamp = conversionTimestamp;
        this.totalItemsRequiringReview = reviewItems.size();
        this.summaryBySeverity = summaryBySeverity;
        this.summaryByType = summaryByType;
        this.summaryByFile = summaryByFile;
        this.reviewItems = reviewItems;
        this.instructions = defaultInstructions();
    }

    private static Map<String, Object> defaultInstructions() {
        Map<String, Object> instructions = new LinkedHashMap<>();
        instructions.put("overview",
                "This file lists the conversion items that could not be converted automatically.");
        instructions.put("next_steps", Arrays.asList(
                "1. Review each item in the review_items section",
                "2. Check the suggested_action of the item if provided",
                "3. Convert the identified patterns by hand",
                "4. Update the status field to COMPLETED when done",
                "5. Re-run the conversion if needed"));
        Map<String, String> severities = new LinkedHashMap<>();
        severities.put(ReviewSeverity.ERROR.name(), "Critical issues that will prevent compilation/execution");
        severities.put(ReviewSeverity.WARNING.name(), "Issues that may cause runtime problems or performance degradation");
        severities.put(ReviewSeverity.INFO.name(), "Best practice recommendations or potential improvements");
        instructions.put("severity_levels", severities);
        return instructions;
    }

    public String getConversionTimestamp() {
        return conversionTimestamp;
    }

    public int getTotalItemsRequiringReview() {
        return totalItemsRequiringReview;
    }

    public Map<String, Long> getSummaryBySeverity() {
        return summaryBySeverity;
    }

    public Map<String, Long> getSummaryByType() {
        return summaryByType;
    }

    public Map<String, Long> getSummaryByFile() {
        return summaryByFile;
    }

    public List<ManualReviewItem> getReviewItems() {
        return reviewItems;
    }

    public Map<String, Object> getInstructions() {
        return instructions;
    }
}
