package com.whosly.converter.ast;

import java.util.ArrayList;
import java.util.List;

public class ColumnDefinition extends TableElement {

    private final String name;
    private DataTypeNode dataType;
    private final List<ColumnConstraint> constraints;

    public ColumnDefinition(String name, DataTypeNode dataType, List<ColumnConstraint> constraints) {
        this.name = name;
        this.dataType = dataType;
        this.constraints = new ArrayList<>(constraints);
    }

    public String getName() {
        return name;
    }

    public DataTypeNode getDataType() {
        return dataType;
    }

    public void setDataType(DataTypeNode dataType) {
        this.dataType = dataType;
    }

    public List<ColumnConstraint> getConstraints() {
        return constraints;
    }

    public boolean isIdentity() {
        for (ColumnConstraint constraint : constraints) {
            if (constraint instanceof IdentityConstraint) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
