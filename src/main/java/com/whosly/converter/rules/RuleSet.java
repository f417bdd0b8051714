package com.whosly.converter.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Conversion rules of one dialect pair. Read-only once built; an empty rule set changes nothing.
 *
 * All type-name keys are upper-cased. Lookups also try the name without underscores, so
 * {@code TIMESTAMP_NTZ} and {@code TIMESTAMPNTZ} resolve to the same entry.
 */
public class RuleSet {

    private static final Logger log = LoggerFactory.getLogger(RuleSet.class);

    private final BehaviorSettings behaviors;
    private final Map<String, String> typeMap;
    private final Map<String, DynamicSizingRule> dynamicRules;
    private final Set<String> paramlessTargets;
    private final Map<String, String> outputAliases;
    private final List<Pattern> skipPatterns;

    private RuleSet(BehaviorSettings behaviors, Map<String, String> typeMap,
                    Map<String, DynamicSizingRule> dynamicRules, Set<String> paramlessTargets,
                    Map<String, String> outputAliases, List<Pattern> skipPatterns) {
        this.behaviors = behaviors;
        this.typeMap = Collections.unmodifiableMap(typeMap);
        this.dynamicRules = Collections.unmodifiableMap(dynamicRules);
        this.paramlessTargets = Collections.unmodifiableSet(paramlessTargets);
        this.outputAliases = Collections.unmodifiableMap(outputAliases);
        this.skipPatterns = Collections.unmodifiableList(skipPatterns);
    }

    public static RuleSet empty() {
        return from(MissingNode.getInstance(), MissingNode.getInstance(), null);
    }

    /**
     * @param behaviors     contents of {@code dialect_behaviors.json}
     * @param dataTypes     contents of {@code data_types.json}
     * @param targetVersion version whose {@code version_overrides} entry is merged over the defaults
     */
    public static RuleSet from(JsonNode behaviors, JsonNode dataTypes, String targetVersion) {
        BehaviorSettings settings = BehaviorSettings.from(behaviors);

        Map<String, String> typeMap = new LinkedHashMap<>();
        putTextEntries(typeMap, dataTypes.path("default"));
        if (targetVersion != null) {
            putTextEntries(typeMap, dataTypes.path("version_overrides").path(targetVersion).path("default"));
        }
        addUnderscoreAliases(typeMap);

        Map<String, DynamicSizingRule> dynamicRules = new LinkedHashMap<>();
        JsonNode dynamic = dataTypes.path("dynamic_rules");
        Iterator<Map.Entry<String, JsonNode>> it = dynamic.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isObject()) {
                dynamicRules.put(upper(entry.getKey()), DynamicSizingRule.from(entry.getValue()));
            }
        }
        addUnderscoreAliases(dynamicRules);

        Set<String> paramless = new LinkedHashSet<>();
        for (JsonNode item : dataTypes.path("paramless_targets")) {
            paramless.add(upper(item.asText()));
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        putTextEntries(aliases, dataTypes.path("output_aliases"));

        List<Pattern> skip = new ArrayList<>();
        if (settings.isStatementSkipping()) {
            for (String regex : settings.getSkipPatterns()) {
                try {
                    skip.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
                } catch (PatternSyntaxException e) {
                    log.error("Ignoring invalid skip pattern '{}': {}", regex, e.getDescription());
                }
            }
        }
        return new RuleSet(settings, typeMap, dynamicRules, paramless, aliases, skip);
    }

    private static void putTextEntries(Map<String, String> target, JsonNode object) {
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue().isTextual()) {
                target.put(upper(entry.getKey()), entry.getValue().asText());
            }
        }
    }

    private static <V> void addUnderscoreAliases(Map<String, V> map) {
        Map<String, V> aliases = new LinkedHashMap<>();
        for (Map.Entry<String, V> entry : map.entrySet()) {
            String alias = entry.getKey().replace("_", "");
            if (!alias.equals(entry.getKey()) && !map.containsKey(alias)) {
                aliases.put(alias, entry.getValue());
            }
        }
        map.putAll(aliases);
    }

    private static <V> V lookup(Map<String, V> map, String typeName) {
        String key = upper(typeName);
        V value = map.get(key);
        if (value == null) {
            value = map.get(key.replace("_", ""));
        }
        return value;
    }

    private static String upper(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }

    public BehaviorSettings getBehaviors() {
        return behaviors;
    }

    /**
     * @return the mapped target type string, or null when the type has no mapping
     */
    public String lookupType(String typeName) {
        return lookup(typeMap, typeName);
    }

    public DynamicSizingRule lookupDynamicRule(String typeName) {
        return lookup(dynamicRules, typeName);
    }

    public boolean isParamless(String targetTypeName) {
        return paramlessTargets.contains(upper(targetTypeName));
    }

    public Map<String, String> getTypeMap() {
        return typeMap;
    }

    public Map<String, DynamicSizingRule> getDynamicRules() {
        return dynamicRules;
    }

    public Set<String> getParamlessTargets() {
        return paramlessTargets;
    }

    public Map<String, String> getOutputAliases() {
        return outputAliases;
    }

    /**
     * @return compiled skip patterns; empty when statement skipping is disabled
     */
    public List<Pattern> getSkipPatterns() {
        return skipPatterns;
    }

    public boolean shouldSkip(String statementText) {
        for (Pattern pattern : skipPatterns) {
            if (pattern.matcher(statementText).find()) {
                return true;
            }
        }
        return false;
    }
}
