package com.whosly.converter.controller;

import com.whosly.converter.parser.SqlDialect;
import com.whosly.converter.service.ConversionOrchestrator;
import com.whosly.converter.service.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Component
public class ConversionController {

    private static final Logger log = LoggerFactory.getLogger(ConversionController.class);

    private final ConversionOrchestrator orchestrator;

    @Autowired
    public ConversionController(ConversionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Convert every script in a directory. Never throws; failures come back as an error result.
     */
    public RunResult convert(String sourceDialect, String targetDialect, String sourceDir, boolean generateCleanup) {
        try {
            SqlDialect source = SqlDialect.fromName(sourceDialect);
            SqlDialect target = SqlDialect.fromName(targetDialect);
            if (sourceDir == null || sourceDir.trim().isEmpty()) {
                return RunResult.error("Source directory is required");
            }
            Path dir = Paths.get(sourceDir.trim());
            if (!Files.isDirectory(dir)) {
                return RunResult.error("Source directory does not exist: " + dir);
            }
            return orchestrator.convert(source, target, dir, generateCleanup);
        } catch (IllegalArgumentException e) {
            log.error("Invalid conversion request: {}", e.getMessage());
            return RunResult.error(e.getMessage());
        } catch (Exception e) {
            log.error("Error converting {}", sourceDir, e);
            return RunResult.error("Error converting " + sourceDir + ": " + e.getMessage());
        }
    }
}
