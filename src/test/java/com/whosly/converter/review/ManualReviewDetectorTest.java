package com.whosly.converter.review;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whosly.converter.parser.OpaqueStatement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ManualReviewDetectorTest {

    @TempDir
    Path outputDir;

    @Test
    void testDetectsPatternsInCode() {
        ManualReviewCollector collector = new ManualReviewCollector(outputDir, new ObjectMapper());
        ManualReviewDetector detector = new ManualReviewDetector(collector);

        int found = detector.inspect(new OpaqueStatement(
                "CREATE OR REPLACE FUNCTION util.parse_js(x VARIANT) RETURNS VARIANT LANGUAGE JAVASCRIPT AS $$ return x; $$",
                12, 0, "unsupported"), "funcs.sql");

        assertThat(found).isEqualTo(2);
        assertThat(collector.countByType()).containsKeys("EXTERNAL_LANGUAGE", "COMPLEX_DATA_TYPES");
        ManualReviewItem item = collector.getItems().get(0);
        assertThat(item.getObjectName()).isEqualTo("util.parse_js");
        assertThat(item.getObjectType()).isEqualTo("FUNCTION");
        assertThat(item.getLineNumber()).isEqualTo(12);
    }

    @Test
    void testIgnoresCommentsAndCleanStatements() {
        ManualReviewCollector collector = new ManualReviewCollector(outputDir, new ObjectMapper());
        ManualReviewDetector detector = new ManualReviewDetector(collector);

        int found = detector.inspect(new OpaqueStatement(
                "-- QUALIFY and EXECUTE IMMEDIATE only in a comment\nSELECT id FROM t", 1, 0, "x"), "a.sql");

        assertThat(found).isZero();
        assertThat(collector.size()).isZero();
    }

    @Test
    void testObjectRefFallback() {
        ManualReviewDetector.ObjectRef ref = ManualReviewDetector.ObjectRef.of("SELECT 1", 5);

        assertThat(ref.getName()).isEqualTo("statement@line5");
        assertThat(ref.getType()).isNull();
    }
}
