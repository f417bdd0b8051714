package com.whosly.converter.rules;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Size-dependent target type: templated while the size fits, the overflow type beyond it.
 */
public class DynamicSizingRule {

    public static final long DEFAULT_MAX_SIZE = 4000;

    private final long maxSize;
    private final String overflowType;
    private final String template;

    public DynamicSizingRule(long maxSize, String overflowType, String template) {
        this.maxSize = maxSize;
        this.overflowType = overflowType;
        this.template = template;
    }

    static DynamicSizingRule from(JsonNode node) {
        return new DynamicSizingRule(
                node.path("max_size").asLong(DEFAULT_MAX_SIZE),
                textOrNull(node.get("overflow_type")),
                textOrNull(node.get("template")));
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    public long getMaxSize() {
        return maxSize;
    }

    public String getOverflowType() {
        return overflowType;
    }

    public String getTemplate() {
        return template;
    }

    /**
     * @param size         declared source size
     * @param fallbackType type used when the rule has no overflow type or template
     * @return the target type string for that size
     */
    public String resolve(long size, String fallbackType) {
        if (size > maxSize) {
            return overflowType != null ? overflowType : fallbackType;
        }
        if (template != null) {
            return template.replace("{size}", Long.toString(size));
        }
        return fallbackType;
    }

    public boolean overflows(long size) {
        return size > maxSize;
    }
}
