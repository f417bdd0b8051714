package com.whosly.converter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whosly.converter.convert.DdlRewriter;
import com.whosly.converter.convert.StatementRouter;
import com.whosly.converter.grammar.DialectGrammar;
import com.whosly.converter.grammar.GrammarRegistry;
import com.whosly.converter.parser.DruidSqlParser;
import com.whosly.converter.parser.SqlDialect;
import com.whosly.converter.parser.SqlParser;
import com.whosly.converter.review.ManualReviewCollector;
import com.whosly.converter.review.ManualReviewDetector;
import com.whosly.converter.rules.RuleLoader;
import com.whosly.converter.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a conversion over a directory of scripts.
 *
 * <p>Discover, convert every file, write the cleanup script and the reports. Only an empty
 * source directory or an unwritable output directory ends a run early; a bad file never does.
 */
public class ConversionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversionOrchestrator.class);

    public static final String SUMMARY_FILE = "conversion_summary.json";

    private static final DateTimeFormatter DIR_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final GrammarRegistry grammars;
    private final RuleLoader ruleLoader;
    private final ObjectMapper objectMapper;
    private final String targetVersion;
    private final int parallelism;
    private final String sqlExtension;

    public ConversionOrchestrator(GrammarRegistry grammars, RuleLoader ruleLoader, ObjectMapper objectMapper,
                                  String targetVersion, int parallelism, String sqlExtension) {
        this.grammars = grammars;
        this.ruleLoader = ruleLoader;
        this.objectMapper = objectMapper;
        this.targetVersion = targetVersion;
        this.parallelism = Math.max(1, parallelism);
        this.sqlExtension = sqlExtension;
    }

    public RunResult convert(SqlDialect source, SqlDialect target, Path sourceDir, boolean generateCleanup) {
        return convert(source, target, sourceDir, generateCleanup, null);
    }

    /**
     * @param outputOverride directory to write into instead of a fresh timestamped one; may be null
     */
    public RunResult convert(SqlDialect source, SqlDialect target, Path sourceDir, boolean generateCleanup,
                             Path outputOverride) {
        log.info("Starting conversion {} -> {} for {}", source.getDisplayName(), target.getDisplayName(), sourceDir);

        List<Path> files;
        try {
            files = discover(sourceDir);
        } catch (IOException e) {
            log.error("Cannot list source directory {}", sourceDir, e);
            return RunResult.error("Cannot read source directory " + sourceDir + ": " + e.getMessage());
        }
        if (files.isEmpty()) {
            log.error("No SQL files found in {}", sourceDir);
            return RunResult.error("No " + sqlExtension + " files found in " + sourceDir);
        }

        Path outputDir;
        try {
            outputDir = outputOverride != null
                    ? Files.createDirectories(outputOverride)
                    : createOutputDirectory(sourceDir.toAbsolutePath().getParent());
        } catch (IOException e) {
            log.error("Cannot create output directory for {}", sourceDir, e);
            return RunResult.error("Cannot create output directory: " + e.getMessage());
        }
        log.info("Writing converted files to {}", outputDir);

        RuleSet rules = ruleLoader.loadRuleSet(source, target, targetVersion);
        DialectGrammar sourceGrammar = grammars.grammarFor(source);
        SqlParser parser = new DruidSqlParser(source, sourceGrammar);
        ManualReviewCollector reviews = new ManualReviewCollector(outputDir, objectMapper);
        DdlRewriter rewriter = new DdlRewriter(sourceGrammar, grammars.grammarFor(target), rules, reviews);
        StatementRouter router = new StatementRouter(parser, target, rewriter, reviews,
                new ManualReviewDetector(reviews));
        SqlFileConverter fileConverter = new SqlFileConverter(parser, router, rules, outputDir);

        List<FileResult> results = parallelism > 1 && files.size() > 1
                ? convertParallel(fileConverter, files)
                : convertSequential(fileConverter, files);

        String cleanupScript = null;
        if (generateCleanup) {
            cleanupScript = writeCleanup(target, outputDir, results);
        }

        Path reviewReport = reviews.flush();
        RunStatistics statistics = RunStatistics.of(results);
        RunSummary summary = new RunSummary(statistics, results, outputDir.toString(), cleanupScript,
                reviewReport == null ? null : reviewReport.toString());
        Path summaryFile = writeSummary(outputDir, summary);

        log.info("Conversion finished: {}", statistics);
        if (reviews.size() > 0) {
            log.info("{}", reviews.summaryText());
        }

        List<FileOutcome> outcomes = new ArrayList<>();
        for (FileResult result : results) {
            outcomes.add(FileOutcome.of(result));
        }
        boolean failed = statistics.getFilesConverted() == 0 && statistics.getFilesFailed() > 0;
        return new RunResult(failed ? RunStatus.ERROR : RunStatus.SUCCESS,
                failed ? "No file could be converted" : "Conversion completed: " + statistics,
                outputDir.toString(), outcomes, summaryFile == null ? null : summaryFile.toString());
    }

    List<Path> discover(Path sourceDir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(sourceDir)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path) && path.getFileName().toString().endsWith(sqlExtension)) {
                    files.add(path);
                }
            }
        }
        Collections.sort(files);
        log.info("Found {} SQL file(s) in {}", files.size(), sourceDir);
        return files;
    }

    /**
     * Creates {@code converted/<timestamp>} under the parent, appending {@code _1}, {@code _2}, ... if taken.
     */
    static Path createOutputDirectory(Path parent) throws IOException {
        Path base = parent.resolve("converted");
        Files.createDirectories(base);
        String name = LocalDateTime.now().format(DIR_TIMESTAMP);
        for (int attempt = 0; ; attempt++) {
            Path candidate = base.resolve(attempt == 0 ? name : name + "_" + attempt);
            try {
                return Files.createDirectory(candidate);
            } catch (FileAlreadyExistsException e) {
                log.debug("Output directory {} exists, trying next suffix", candidate);
            }
        }
    }

    private List<FileResult> convertSequential(SqlFileConverter converter, List<Path> files) {
        List<FileResult> results = new ArrayList<>();
        for (Path file : files) {
            results.add(converter.convert(file));
        }
        return results;
    }

    private List<FileResult> convertParallel(SqlFileConverter converter, List<Path> files) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, files.size()));
        try {
            List<CompletableFuture<FileResult>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(CompletableFuture.supplyAsync(() -> converter.convert(file), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            // discovery order
            List<FileResult> results = new ArrayList<>();
            for (CompletableFuture<FileResult> future : futures) {
                results.add(future.join());
            }
            return results;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.HOURS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private String writeCleanup(SqlDialect target, Path outputDir, List<FileResult> results) {
        List<String> converted = new ArrayList<>();
        for (FileResult result : results) {
            if (result.getOutputPath() != null) {
                converted.addAll(result.getStatements());
            }
        }
        try {
            Path script = new CleanupScriptGenerator(target).write(outputDir, converted);
            return script == null ? null : script.toString();
        } catch (IOException e) {
            log.error("Failed to write cleanup script in {}", outputDir, e);
            return null;
        }
    }

    private Path writeSummary(Path outputDir, RunSummary summary) {
        Path file = outputDir.resolve(SUMMARY_FILE);
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), summary);
            log.info("Summary written to {}", file);
            return file;
        } catch (IOException e) {
            log.error("Failed to write summary {}", file, e);
            return null;
        }
    }
}
