package com.whosly.converter.ast;

/**
 * {@code NAME = value} or a bare keyword property such as {@code COPY GRANTS} (value is null).
 */
public class NamedProperty extends TableProperty {

    private final String name;
    private final String value;

    public NamedProperty(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
