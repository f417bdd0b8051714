package com.whosly.converter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whosly.converter.grammar.GrammarRegistry;
import com.whosly.converter.rules.RuleLoader;
import com.whosly.converter.service.ConversionOrchestrator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Configuration
public class ConverterConfig {

    // 规则目录: <root>/<source>_<target>/ddl_conversion_rules/
    @Value("${converter.rules-root:config/conversion}")
    private String rulesRoot;

    // 目标数据库版本, 用于 version_overrides
    @Value("${converter.target-version:19c}")
    private String targetVersion;

    @Value("${converter.parallelism:1}")
    private int parallelism;

    @Value("${converter.sql-extension:.sql}")
    private String sqlExtension;

    @Bean
    public GrammarRegistry grammarRegistry() {
        return GrammarRegistry.withDefaultExtensions();
    }

    @Bean
    public RuleLoader ruleLoader(ObjectMapper objectMapper) {
        return new RuleLoader(Paths.get(rulesRoot), objectMapper);
    }

    @Bean
    public ConversionOrchestrator conversionOrchestrator(GrammarRegistry grammarRegistry, RuleLoader ruleLoader,
                                                         ObjectMapper objectMapper) {
        return new ConversionOrchestrator(grammarRegistry, ruleLoader, objectMapper, targetVersion, parallelism,
                sqlExtension);
    }

    public String getRulesRoot() {
        return rulesRoot;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public int getParallelism() {
        return parallelism;
    }

    public String getSqlExtension() {
        return sqlExtension;
    }
}
