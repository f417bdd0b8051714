package com.whosly.converter.review;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ManualReviewCollectorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path outputDir;

    @Test
    void testRecordAndCount() {
        ManualReviewCollector collector = new ManualReviewCollector(outputDir, objectMapper);

        collector.record(ReviewPattern.UPDATE_FROM_SYNTAX, "a.sql", "orders_tbl", null, "update from", 3);
        collector.record(ReviewPattern.QUALIFY_CLAUSE, "b.sql", "daily_view", null, "qualify", 8);
        collector.record(ReviewPattern.QUALIFY_CLAUSE, "b.sql", "x", "VIEW", "qualify", null);

        assertThat(collector.size()).isEqualTo(3);
        assertThat(collector.countBySeverity()).containsEntry("ERROR", 1L).containsEntry("WARNING", 2L);
        Map<String, Long> byType = collector.countByType();
        assertThat(byType.keySet()).containsExactly("QUALIFY_CLAUSE", "UPDATE_FROM_SYNTAX");
        assertThat(collector.countByFile().keySet()).containsExactly("b.sql", "a.sql");

        ManualReviewItem first = collector.getItems().get(0);
        assertThat(first.getObjectType()).isEqualTo("TABLE");
        assertThat(first.getSeverity()).isEqualTo(ReviewSeverity.ERROR);
        assertThat(first.getSuggestedAction()).isEqualTo(ReviewPattern.UPDATE_FROM_SYNTAX.getSuggestedAction());
        assertThat(first.getStatus()).isEqualTo(ManualReviewItem.PENDING_REVIEW);
        assertThat(collector.getItems().get(1).getObjectType()).isEqualTo("VIEW");
    }

    @Test
    void testDetectObjectType() {
        assertThat(ManualReviewCollector.detectObjectType("calc_func")).isEqualTo("FUNCTION");
        assertThat(ManualReviewCollector.detectObjectType("LOAD_PROCEDURE")).isEqualTo("PROCEDURE");
        assertThat(ManualReviewCollector.detectObjectType("dim_tbl")).isEqualTo("TABLE");
        assertThat(ManualReviewCollector.detectObjectType("sales_view")).isEqualTo("VIEW");
        assertThat(ManualReviewCollector.detectObjectType("statement@line4")).isEqualTo("UNKNOWN");
    }

    @Test
    void testFlushWritesReportOnlyWithItems() throws Exception {
        ManualReviewCollector empty = new ManualReviewCollector(outputDir, objectMapper);
        assertThat(empty.flush()).isNull();
        assertThat(empty.summaryText()).isEqualTo("No manual review items found.");

        ManualReviewCollector collector = new ManualReviewCollector(outputDir, objectMapper);
        collector.record("a.sql", "t", "TABLE", "CUSTOM", "check it", ReviewSeverity.INFO, null, 1);
        Path report = collector.flush();

        assertThat(report).isNotNull();
        assertThat(report.getFileName().toString()).startsWith("manual_review_required_").endsWith(".json");
        assertThat(collector.flush()).isEqualTo(report);
        try (java.util.stream.Stream<Path> files = Files.list(outputDir)) {
            assertThat(files.count()).isEqualTo(1);
        }

        JsonNode json = objectMapper.readTree(report.toFile());
        assertThat(json.path("total_items_requiring_review").asInt()).isEqualTo(1);
        assertThat(json.path("summary_by_severity").path("INFO").asLong()).isEqualTo(1L);
        assertThat(json.path("summary_by_type").path("CUSTOM").asLong()).isEqualTo(1L);
        assertThat(json.path("review_items").get(0).path("issue_type").asText()).isEqualTo("CUSTOM");
        assertThat(json.path("review_items").get(0).path("status").asText()).isEqualTo("PENDING_REVIEW");
        assertThat(json.path("instructions").path("next_steps").isArray()).isTrue();
        assertThat(collector.summaryText()).contains("Total Items Requiring Review: 1");
    }

    @Test
    void testConcurrentRecording() {
        ManualReviewCollector collector = new ManualReviewCollector(outputDir, objectMapper);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            final String file = "f" + i + ".sql";
            futures.add(CompletableFuture.runAsync(() -> {
                for (int j = 0; j < 50; j++) {
                    collector.record(ReviewPattern.DYNAMIC_SQL, file, "proc_" + j, null, "dynamic", j);
                }
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertThat(collector.size()).isEqualTo(400);
        assertThat(collector.countByFile()).hasSize(8);
    }
}
