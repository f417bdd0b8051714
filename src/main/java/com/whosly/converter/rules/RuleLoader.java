package com.whosly.converter.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whosly.converter.parser.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads JSON rule documents from {@code <root>/<source>_<target>/<category>/<file>}.
 *
 * A missing file is normal. Malformed or unreadable files are logged and treated as empty.
 */
public class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);

    public static final String DDL_RULES = "ddl_conversion_rules";
    public static final String BEHAVIORS_FILE = "dialect_behaviors.json";
    public static final String DATA_TYPES_FILE = "data_types.json";

    private final Path rulesRoot;
    private final ObjectMapper objectMapper;

    public RuleLoader(Path rulesRoot, ObjectMapper objectMapper) {
        this.rulesRoot = rulesRoot;
        this.objectMapper = objectMapper;
    }

    public Path getRulesRoot() {
        return rulesRoot;
    }

    /**
     * @return the path a rule document would be read from, or null when no root is configured
     */
    public Path resolve(SqlDialect source, SqlDialect target, String category, String fileName) {
        if (rulesRoot == null) {
            return null;
        }
        return rulesRoot
                .resolve(source.getConfigKey() + "_" + target.getConfigKey())
                .resolve(category)
                .resolve(fileName);
    }

    /**
     * Load one rule document.
     *
     * @return the parsed object, or an empty object if the document is absent or unusable
     */
    public ObjectNode load(SqlDialect source, SqlDialect target, String category, String fileName) {
        Path path = resolve(source, target, category, fileName);
        if (path == null) {
            log.error("No rules root configured, cannot load {} for {} -> {}", fileName, source, target);
            return objectMapper.createObjectNode();
        }
        if (!Files.isRegularFile(path)) {
            log.info("Configuration file not found (this may be expected): {}", path);
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(path.toFile());
            if (node == null || !node.isObject()) {
                log.error("Rule document {} is not a JSON object, ignoring it", path);
                return objectMapper.createObjectNode();
            }
            log.debug("Loaded configuration from {}", path);
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            log.error("Error decoding JSON from {}", path, e);
            return objectMapper.createObjectNode();
        } catch (IOException e) {
            log.error("File system error loading configuration file {}", path, e);
            return objectMapper.createObjectNode();
        }
    }

    /**
     * Load the DDL rule set of a dialect pair.
     *
     * @param targetVersion key under {@code version_overrides}; may be null
     */
    public RuleSet loadRuleSet(SqlDialect source, SqlDialect target, String targetVersion) {
        ObjectNode behaviors = load(source, target, DDL_RULES, BEHAVIORS_FILE);
        ObjectNode dataTypes = load(source, target, DDL_RULES, DATA_TYPES_FILE);
        RuleSet ruleSet = RuleSet.from(behaviors, dataTypes, targetVersion);
        log.info("Rule set for {} -> {} (version {}): {} type mappings, {} dynamic rules, {} skip patterns",
                source.getDisplayName(), target.getDisplayName(), targetVersion,
                ruleSet.getTypeMap().size(), ruleSet.getDynamicRules().size(), ruleSet.getSkipPatterns().size());
        return ruleSet;
    }
}
