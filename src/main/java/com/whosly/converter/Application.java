package com.whosly.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the SQL Dialect Converter.
 *
 * Converts directories of SQL scripts from one database dialect to another, driven by
 * per-dialect-pair rule bundles.
 */
@SpringBootApplication
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    // 注入ConverterConfig以输出当前配置
    @Autowired
    private com.whosly.converter.config.ConverterConfig converterConfig;

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
        log.info("SQL Dialect Converter started successfully");
    }

    @EventListener
    public void onApplicationEvent(ContextRefreshedEvent event) {
        log.info("=== Converter Configuration ===");
        log.info("Rules Root: {}", converterConfig.getRulesRoot());
        log.info("Target Version: {}", converterConfig.getTargetVersion());
        log.info("Parallelism: {}", converterConfig.getParallelism());
        log.info("SQL Extension: {}", converterConfig.getSqlExtension());
        log.info("=== End Converter Configuration ===");
    }
}
