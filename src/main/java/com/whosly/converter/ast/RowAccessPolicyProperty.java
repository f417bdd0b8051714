package com.whosly.converter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code WITH ROW ACCESS POLICY name ON (col, ...)}.
 */
public class RowAccessPolicyProperty extends TableProperty implements ExtensionClause {

    public static final String RULE_NAME = "row_access_policy";

    private final String policyName;
    private final List<String> columns;

    public RowAccessPolicyProperty(String policyName, List<String> columns) {
        this.policyName = policyName;
        this.columns = new ArrayList<>(columns);
    }

    public String getPolicyName() {
        return policyName;
    }

    public List<String> getColumns() {
        return columns;
    }

    @Override
    public String getRuleName() {
        return RULE_NAME;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visitExtension(this);
    }
}
