package com.whosly.converter.ast;

public class TableCommentProperty extends TableProperty {

    private final String text;

    public TableCommentProperty(String text) {
        this.text = text;
    }

    /**
     * @return comment text, unescaped
     */
    public String getText() {
        return text;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
