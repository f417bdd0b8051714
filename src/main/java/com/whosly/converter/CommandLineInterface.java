package com.whosly.converter;

import com.whosly.converter.controller.ConversionController;
import com.whosly.converter.service.FileOutcome;
import com.whosly.converter.service.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CommandLineInterface implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    private static final String USAGE = "Usage: convert <source-dialect> <target-dialect> <source-dir> [--cleanup]";

    private final ConversionController conversionController;

    @Autowired
    public CommandLineInterface(ConversionController conversionController) {
        this.conversionController = conversionController;
    }

    @Override
    public void run(String... args) throws Exception {
        boolean cleanup = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if ("--cleanup".equals(arg)) {
                cleanup = true;
            } else if (!arg.startsWith("--")) {
                // 其他 --xxx 参数交给 Spring 处理
                positional.add(arg);
            }
        }

        if (positional.isEmpty()) {
            log.info("SQL Dialect Converter CLI");
            log.info(USAGE);
            return;
        }
        if (!"convert".equalsIgnoreCase(positional.get(0)) || positional.size() != 4) {
            log.info("Unknown command. {}", USAGE);
            return;
        }

        RunResult result = conversionController.convert(positional.get(1), positional.get(2), positional.get(3), cleanup);
        if (result.isSuccess()) {
            log.info("Conversion succeeded, output: {}", result.getOutputDir());
        } else {
            log.error("Conversion failed: {}", result.getMessage());
        }
        for (FileOutcome outcome : result.getFileResults()) {
            log.info("  {} [{}] {}", outcome.getFileName(), outcome.getStatus().getValue(), outcome.getMessage());
        }
        if (result.getSummaryFilePath() != null) {
            log.info("Summary: {}", result.getSummaryFilePath());
        }
    }
}
