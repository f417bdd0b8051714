package com.whosly.converter.ast;

/**
 * Column option the rewriter does not touch ({@code PRIMARY KEY}, {@code REFERENCES ...}, {@code COLLATE ...}).
 */
public class RawConstraint extends ColumnConstraint {

    private final String text;

    public RawConstraint(String text) {
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
