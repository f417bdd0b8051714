package com.whosly.converter.ast;

/**
 * One {@code key = 'value'} pair of a tag list.
 */
public class TagAssignment {

    private final String key;
    private final String value;

    public TagAssignment(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the value, unescaped
     */
    public String getValue() {
        return value;
    }
}
