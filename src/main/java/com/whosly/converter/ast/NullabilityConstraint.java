package com.whosly.converter.ast;

public class NullabilityConstraint extends ColumnConstraint {

    private final boolean nullable;

    public NullabilityConstraint(boolean nullable) {
        this.nullable = nullable;
    }

    public boolean isNullable() {
        return nullable;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
