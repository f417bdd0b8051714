package com.whosly.converter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-level {@code [WITH] MASKING POLICY name [USING (col, ...)]}.
 */
public class MaskingPolicyConstraint extends ColumnConstraint implements ExtensionClause {

    public static final String RULE_NAME = "masking_policy";

    private final boolean withKeyword;
    private final String policyName;
    private final List<String> usingColumns;

    public MaskingPolicyConstraint(boolean withKeyword, String policyName, List<String> usingColumns) {
        this.withKeyword = withKeyword;
        this.policyName = policyName;
        this.usingColumns = new ArrayList<>(usingColumns);
    }

    public boolean isWithKeyword() {
        return withKeyword;
    }

    public String getPolicyName() {
        return policyName;
    }

    /**
     * @return the USING column list, empty when the clause has none
     */
    public List<String> getUsingColumns() {
        return usingColumns;
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
