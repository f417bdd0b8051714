package com.whosly.converter.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Typed view of {@code dialect_behaviors.json}. Every toggle defaults to off.
 */
public class BehaviorSettings {

    private final boolean virtualColumnConversion;
    private final boolean clauseRemoval;
    private final List<String> removedClauses;
    private final boolean withPropertyRemoval;
    private final Set<String> removedProperties;
    private final boolean commentConversion;
    private final String tableCommentTemplate;
    private final String columnCommentTemplate;
    private final boolean statementSkipping;
    private final List<String> skipPatterns;
    private final boolean stripProceduralBlocks;
    private final boolean tableModifierRemoval;
    private final Set<String> removedModifiers;

    private BehaviorSettings(JsonNode root) {
        JsonNode virtualColumns = root.path("virtual_column_conversion");
        this.virtualColumnConversion = virtualColumns.path("enabled").asBoolean(false);

        JsonNode clauses = root.path("clause_removal");
        this.clauseRemoval = clauses.path("enabled").asBoolean(false);
        this.removedClauses = Collections.unmodifiableList(upperList(clauses.path("clauses")));

        JsonNode properties = root.path("with_property_removal");
        this.withPropertyRemoval = properties.path("enabled").asBoolean(false);
        this.removedProperties = Collections.unmodifiableSet(new LinkedHashSet<>(upperList(properties.path("properties"))));

        JsonNode comments = root.path("comment_conversion");
        this.commentConversion = comments.path("enabled").asBoolean(false);
        this.tableCommentTemplate = textOrNull(comments.get("target_table_template"));
        this.columnCommentTemplate = textOrNull(comments.get("target_column_template"));

        JsonNode skipping = root.path("statement_skipping");
        this.statementSkipping = skipping.path("enabled").asBoolean(false);
        this.skipPatterns = Collections.unmodifiableList(textList(skipping.path("patterns")));

        // either "strip_procedural_blocks": true or "strip_procedural_blocks": {"enabled": true}
        JsonNode strip = root.path("strip_procedural_blocks");
        this.stripProceduralBlocks = strip.isObject() ? strip.path("enabled").asBoolean(false) : strip.asBoolean(false);

        JsonNode modifiers = root.path("table_modifier_removal");
        this.tableModifierRemoval = modifiers.path("enabled").asBoolean(false);
        this.removedModifiers = Collections.unmodifiableSet(new LinkedHashSet<>(upperList(modifiers.path("modifiers"))));
    }

    public static BehaviorSettings from(JsonNode root) {
        return new BehaviorSettings(root == null ? MissingNode.getInstance() : root);
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode item : array) {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            }
        }
        return values;
    }

    private static List<String> upperList(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (String value : textList(array)) {
            values.add(value.trim().toUpperCase(Locale.ROOT));
        }
        return values;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    public boolean isVirtualColumnConversion() {
        return virtualColumnConversion;
    }

    public boolean isClauseRemoval() {
        return clauseRemoval;
    }

    /**
     * @return clause keywords, upper-cased, e.g. {@code CLUSTER BY}
     */
    public List<String> getRemovedClauses() {
        return removedClauses;
    }

    public boolean isWithPropertyRemoval() {
        return withPropertyRemoval;
    }

    public Set<String> getRemovedProperties() {
        return removedProperties;
    }

    public boolean isCommentConversion() {
        return commentConversion;
    }

    public String getTableCommentTemplate() {
        return tableCommentTemplate;
    }

    public String getColumnCommentTemplate() {
        return columnCommentTemplate;
    }

    public boolean isStatementSkipping() {
        return statementSkipping;
    }

    public List<String> getSkipPatterns() {
        return skipPatterns;
    }

    public boolean isStripProceduralBlocks() {
        return stripProceduralBlocks;
    }

    public boolean isTableModifierRemoval() {
        return tableModifierRemoval;
    }

    public Set<String> getRemovedModifiers() {
        return removedModifiers;
    }
}
