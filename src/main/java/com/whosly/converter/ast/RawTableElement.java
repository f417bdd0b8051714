package com.whosly.converter.ast;

/**
 * Table-level constraint kept verbatim, e.g. {@code PRIMARY KEY (ID)}.
 */
public class RawTableElement extends TableElement {

    private final String text;

    public RawTableElement(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
