package com.whosly.converter.ast;

/**
 * Identity / auto-increment option, kept verbatim.
 */
public class IdentityConstraint extends ColumnConstraint {

    private final String text;

    public IdentityConstraint(String text) {
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
