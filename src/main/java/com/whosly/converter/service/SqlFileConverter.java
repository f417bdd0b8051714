package com.whosly.converter.service;

import com.whosly.converter.convert.ConversionAction;
import com.whosly.converter.convert.ConversionLogEntry;
import com.whosly.converter.convert.StatementConversion;
import com.whosly.converter.convert.StatementRouter;
import com.whosly.converter.parser.ParsedStatement;
import com.whosly.converter.parser.SqlParser;
import com.whosly.converter.parser.SqlScriptSplitter;
import com.whosly.converter.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts one script file: strip, parse, filter, convert, write.
 */
public class SqlFileConverter {

    private static final Logger log = LoggerFactory.getLogger(SqlFileConverter.class);

    private final SqlParser parser;
    private final StatementRouter router;
    private final RuleSet rules;
    private final Path outputDir;

    public SqlFileConverter(SqlParser parser, StatementRouter router, RuleSet rules, Path outputDir) {
        this.parser = parser;
        this.router = router;
        this.rules = rules;
        this.outputDir = outputDir;
    }

    /**
     * Never throws; every failure ends up in the returned result.
     */
    public FileResult convert(Path sourceFile) {
        String fileName = sourceFile.getFileName().toString();
        FileResult result = new FileResult(fileName);
        log.info("Processing file: {}", sourceFile);
        try {
            String content = new String(Files.readAllBytes(sourceFile), StandardCharsets.UTF_8);
            convertContent(content, result);
        } catch (IOException e) {
            log.error("Failed to read or write {}", sourceFile, e);
            result.setStatus(FileStatus.ERROR);
            result.setMessage("I/O error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while converting {}", sourceFile, e);
            result.setStatus(FileStatus.ERROR);
            result.setMessage("Unexpected error: " + e.getMessage());
        }
        log.info("Finished {}: {}", fileName, result);
        return result;
    }

    private void convertContent(String content, FileResult result) throws IOException {
        String fileName = result.getFileName();
        if (rules.getBehaviors().isStripProceduralBlocks()) {
            content = ProceduralBlockStripper.strip(content);
        }

        List<ParsedStatement> kept = new ArrayList<>();
        for (ParsedStatement statement : parser.parseScript(content)) {
            String code = SqlScriptSplitter.stripComments(statement.getSqlText()).trim();
            if (rules.shouldSkip(code)) {
                String preview = code.length() > 100 ? code.substring(0, 100) : code;
                log.info("Skipping statement in {}: {}", fileName, preview);
                result.addLog(new ConversionLogEntry(ConversionAction.SKIPPED,
                        "Skipped statement matching a skip pattern: " + preview, fileName, statement.getStartLine()));
                result.countSkipped();
                continue;
            }
            kept.add(statement);
        }
        if (kept.isEmpty()) {
            result.setStatus(FileStatus.SKIPPED);
            result.setMessage("No statements to convert after filtering");
            return;
        }

        for (ParsedStatement statement : kept) {
            StatementConversion conversion = router.route(statement, fileName);
            result.addLogs(conversion.getLogs());
            result.addStatements(conversion.getStatements());
            if (conversion.hasErrors()) {
                result.countWithErrors();
            } else {
                result.countConverted();
            }
        }

        if (result.getStatements().isEmpty()) {
            result.setStatus(FileStatus.SKIPPED);
            result.setMessage("Conversion produced no statements");
            return;
        }

        // statements that fell back are still written out, as source text or error markers
        Path outputFile = outputDir.resolve(fileName);
        Files.write(outputFile, joinStatements(result.getStatements()).getBytes(StandardCharsets.UTF_8));
        result.setOutputPath(outputFile.toString());
        if (result.getStatementsWithErrors() > 0) {
            result.setStatus(FileStatus.PARTIAL);
            result.setMessage(result.getStatementsWithErrors() + " statement(s) converted with errors");
        } else {
            result.setStatus(FileStatus.SUCCESS);
            result.setMessage("Converted " + result.getStatementsConverted() + " statement(s)");
        }
        log.info("Successfully wrote {} statement(s) to: {}", result.getStatements().size(), outputFile);
    }

    /**
     * Joins statements with terminators; the text ends with exactly one newline.
     */
    static String joinStatements(List<String> statements) {
        List<String> parts = new ArrayList<>();
        for (String statement : statements) {
            String text = statement.trim();
            while (text.endsWith(";")) {
                text = text.substring(0, text.length() - 1).trim();
            }
            if (!text.isEmpty()) {
                parts.add(text);
            }
        }
        String joined = String.join(";\n\n", parts) + ";";
        return joined.replace("\r\n", "\n").replace('\r', '\n').trim() + "\n";
    }
}
