package com.whosly.converter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Table-level {@code [WITH] TAG (key = 'value', ...)}.
 */
public class TagProperty extends TableProperty implements ExtensionClause {

    public static final String RULE_NAME = "tag";

    private final boolean withKeyword;
    private final List<TagAssignment> tags;

    public TagProperty(boolean withKeyword, List<TagAssignment> tags) {
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
        return RULE_NAME;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visitExtension(this);
    }
}
