package com.whosly.converter.ast;

/**
 * {@code COMMENT 'text'} on a column. The text is stored unescaped.
 */
public class CommentConstraint extends ColumnConstraint {

    private final String text;

    public CommentConstraint(String text) {
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
