package com.whosly.converter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-level {@code [WITH] TAG (key = 'value', ...)}.
 */
public class TagConstraint extends ColumnConstraint implements ExtensionClause {

    private final boolean withKeyword;
    private final List<TagAssignment> tags;

    public TagConstraint(boolean withKeyword, List<TagAssignment> tags) {
        this.withKeyword = withKeyword;
        this.tags = new ArrayList<>(tags);
    }

    public boolean isWithKeyword() {
        return withKeyword;
    }

    public List<TagAssignment> getTags() {
        return tags;
    }

    @Override
    public String getRuleName() {
        return TagProperty.RULE_NAME;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visitExtension(this);
    }
}
