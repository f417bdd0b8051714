package com.whosly.converter.ast;

public class DefaultConstraint extends ColumnConstraint {

    private final String expression;

    public DefaultConstraint(String expression) {
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
