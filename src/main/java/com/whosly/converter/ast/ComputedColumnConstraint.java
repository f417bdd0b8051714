package com.whosly.converter.ast;

/**
 * Source-side computed column, {@code col type AS (expr)}.
 */
public class ComputedColumnConstraint extends ColumnConstraint {

    private final String expression;

    public ComputedColumnConstraint(String expression) {
        this.expression = expression;
    }

    /**
     * @return the expression text between the parentheses, exactly as written
     */
    public String getExpression() {
        return expression;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
