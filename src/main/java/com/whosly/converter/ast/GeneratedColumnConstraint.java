package com.whosly.converter.ast;

/**
 * {@code GENERATED ALWAYS AS (expr) VIRTUAL}, the target form of a computed column.
 */
public class GeneratedColumnConstraint extends ColumnConstraint {

    private final String expression;

    public GeneratedColumnConstraint(String expression) {
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
