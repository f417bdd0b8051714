package com.whosly.converter.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whosly.converter.grammar.GrammarRegistry;
import com.whosly.converter.parser.SqlDialect;
import com.whosly.converter.rules.RuleLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionOrchestratorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path workDir;

    private ConversionOrchestrator orchestrator(int parallelism) {
        RuleLoader loader = new RuleLoader(Path.of("config", "conversion"), objectMapper);
        return new ConversionOrchestrator(GrammarRegistry.withDefaultExtensions(), loader, objectMapper,
                "19c", parallelism, ".sql");
    }

    private Path sourceDir() throws IOException {
        Path dir = Files.createDirectories(workDir.resolve("scripts"));
        write(dir, "a_tables.sql", "USE DATABASE analytics;\n"
                + "CREATE OR REPLACE TABLE sales.orders (id NUMBER(38,0), note VARCHAR(100));\n"
                + "CREATE VIEW sales.v_orders AS SELECT id FROM sales.orders;\n");
        write(dir, "b_session.sql", "USE WAREHOUSE wh;\nALTER SESSION SET TIMEZONE = 'UTC';\n");
        write(dir, "c_broken.sql", "SELECT * FROM (;\n");
        write(dir, "notes.txt", "CREATE TABLE ignored (a INT);\n");
        return dir;
    }

    private static void write(Path dir, String name, String content) throws IOException {
        Files.write(dir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> names(RunResult result) {
        List<String> names = new ArrayList<>();
        for (FileOutcome outcome : result.getFileResults()) {
            names.add(outcome.getFileName());
        }
        return names;
    }

    @Test
    void testConvertDirectory() throws IOException {
        Path out = workDir.resolve("out");

        RunResult result = orchestrator(1).convert(SqlDialect.SNOWFLAKE, SqlDialect.ORACLE, sourceDir(), true, out);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutputDir()).isEqualTo(out.toString());
        assertThat(names(result)).containsExactly("a_tables.sql", "b_session.sql", "c_broken.sql");
        assertThat(result.getFileResults().get(0).getStatus()).isEqualTo(FileStatus.SUCCESS);
        assertThat(result.getFileResults().get(1).getStatus()).isEqualTo(FileStatus.SKIPPED);
        assertThat(result.getFileResults().get(2).getStatus()).isEqualTo(FileStatus.PARTIAL);

        String converted = new String(Files.readAllBytes(out.resolve("a_tables.sql")), StandardCharsets.UTF_8);
        assertThat(converted).startsWith("CREATE TABLE sales.orders (").doesNotContain("USE DATABASE");
        assertThat(Files.exists(out.resolve("b_session.sql"))).isFalse();
        assertThat(Files.exists(out.resolve("c_broken.sql"))).isTrue();

        String cleanup = new String(Files.readAllBytes(out.resolve(CleanupScriptGenerator.FILE_NAME)),
                StandardCharsets.UTF_8);
        assertThat(cleanup).isEqualTo("DROP TABLE sales.orders CASCADE CONSTRAINTS;\nDROP VIEW sales.v_orders;\n");
    }

    @Test
    void testSummaryFile() throws IOException {
        Path out = workDir.resolve("out");

        RunResult result = orchestrator(1).convert(SqlDialect.SNOWFLAKE, SqlDialect.ORACLE, sourceDir(), true, out);

        assertThat(result.getSummaryFilePath()).isEqualTo(out.resolve(ConversionOrchestrator.SUMMARY_FILE).toString());
        JsonNode summary = objectMapper.readTree(out.resolve(ConversionOrchestrator.SUMMARY_FILE).toFile());
        JsonNode stats = summary.path("overall_statistics");
        assertThat(stats.path("files_processed").asInt()).isEqualTo(3);
        assertThat(stats.path("files_converted").asInt()).isEqualTo(2);
        assertThat(stats.path("files_skipped").asInt()).isEqualTo(1);
        assertThat(stats.path("files_failed").asInt()).isZero();
        assertThat(stats.path("statements_skipped").asInt()).isEqualTo(3);
        assertThat(stats.path("statements_with_errors").asInt()).isEqualTo(1);

        assertThat(summary.path("files").size()).isEqualTo(3);
        assertThat(summary.path("files").get(0).path("file_name").asText()).isEqualTo("a_tables.sql");
        assertThat(summary.path("files").get(0).path("status").asText()).isEqualTo("success");
        assertThat(summary.path("conversion_logs").isArray()).isTrue();
        assertThat(summary.path("conversion_logs").size()).isGreaterThan(0);
        assertThat(summary.path("output_directory").asText()).isEqualTo(out.toString());
        assertThat(summary.path("cleanup_script").asText()).endsWith(CleanupScriptGenerator.FILE_NAME);
        assertThat(summary.path("manual_review_report").asText()).contains("manual_review_required_");
    }

    @Test
    void testNoCleanupWhenNotRequested() throws IOException {
        Path out = workDir.resolve("out");

        orchestrator(1).convert(SqlDialect.SNOWFLAKE, SqlDialect.ORACLE, sourceDir(), false, out);

        assertThat(Files.exists(out.resolve(CleanupScriptGenerator.FILE_NAME))).isFalse();
        JsonNode summary = objectMapper.readTree(out.resolve(ConversionOrchestrator.SUMMARY_FILE).toFile());
        assertThat(summary.path("cleanup_script").isNull()).isTrue();
    }

    @Test
    void testParallelRunKeepsDiscoveryOrder() throws IOException {
        Path out = workDir.resolve("out");

        RunResult result = orchestrator(4).convert(SqlDialect.SNOWFLAKE, SqlDialect.ORACLE, sourceDir(), true, out);

        assertThat(result.isSuccess()).isTrue();
        assertThat(names(result)).containsExactly("a_tables.sql", "b_session.sql", "c_broken.sql");
        assertThat(Files.exists(out.resolve("a_tables.sql"))).isTrue();
    }

    @Test
    void testNoInputLeavesNoOutput() throws IOException {
        Path empty = Files.createDirectories(workDir.resolve("empty"));
        write(empty, "readme.txt", "nothing");

        RunResult result = orchestrator(1).convert(SqlDialect.SNOWFLAKE, SqlDialect.ORACLE, empty, true);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getStatus()).isEqualTo(RunStatus.ERROR);
        assertThat(result.getFileResults()).isEmpty();
        assertThat(Files.exists(workDir.resolve("converted"))).isFalse();
    }

    @Test
    void testFallbackOnlyFileIsWritten() throws IOException {
        Path dir = Files.createDirectories(workDir.resolve("procs"));
        write(dir, "procs.sql", "CREATE OR REPLACE PROCEDURE p() RETURNS STRING LANGUAGE JAVASCRIPT AS $$ return 'x'; $$;\n");
        Path out = workDir.resolve("out");

        RunResult result = orchestrator(1).convert(SqlDialect.SNOWFLAKE, SqlDialect.ORACLE, dir, true, out);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFileResults().get(0).getStatus()).isEqualTo(FileStatus.PARTIAL);
        String written = new String(Files.readAllBytes(out.resolve("procs.sql")), StandardCharsets.UTF_8);
        assertThat(written).contains("LANGUAGE JAVASCRIPT").contains("return 'x';");
        String cleanup = new String(Files.readAllBytes(out.resolve(CleanupScriptGenerator.FILE_NAME)),
                StandardCharsets.UTF_8);
        assertThat(cleanup).isEqualTo("DROP PROCEDURE p;\n");
    }

    @Test
    void testAllFilesFailed() throws IOException {
        Path dir = Files.createDirectories(workDir.resolve("bad"));
        write(dir, "x.sql", "SELECT 1;\n");
        Path out = workDir.resolve("out");
        Files.createDirectories(out.resolve("x.sql"));

        RunResult result = orchestrator(1).convert(SqlDialect.SNOWFLAKE, SqlDialect.ORACLE, dir, true, out);

        assertThat(result.getStatus()).isEqualTo(RunStatus.ERROR);
        assertThat(result.getFileResults()).hasSize(1);
        assertThat(result.getFileResults().get(0).getStatus()).isEqualTo(FileStatus.ERROR);
    }

    @Test
    void testTimestampedOutputDirectory() throws IOException {
        Path first = ConversionOrchestrator.createOutputDirectory(workDir);
        Path second = ConversionOrchestrator.createOutputDirectory(workDir);

        assertThat(first.getParent()).isEqualTo(workDir.resolve("converted"));
        assertThat(second).isNotEqualTo(first);
        assertThat(Files.isDirectory(first)).isTrue();
        assertThat(Files.isDirectory(second)).isTrue();
        assertThat(first.getFileName().toString()).matches("\\d{8}_\\d{6}(_\\d+)?");
    }

    @Test
    void testDefaultOutputNextToSource() throws IOException {
        Path dir = sourceDir();

        RunResult result = orchestrator(1).convert(SqlDialect.SNOWFLAKE, SqlDialect.ORACLE, dir, false);

        Path outputDir = Path.of(result.getOutputDir());
        assertThat(outputDir.getParent()).isEqualTo(workDir.toAbsolutePath().resolve("converted"));
        try (Stream<Path> files = Files.list(outputDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .contains("a_tables.sql", ConversionOrchestrator.SUMMARY_FILE);
        }
    }
}
