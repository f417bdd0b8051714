package com.whosly.converter.ast;

/**
 * Top-level clustering or partitioning clause, e.g. {@code CLUSTER BY (A, B)}.
 */
public class GroupingClause extends TableClause {

    private final String keyword;
    private final String body;

    /**
     * @param keyword clause keyword normalized to single spaces and upper case, e.g. {@code CLUSTER BY}
     * @param body    everything after the keyword, as written
     */
    public GroupingClause(String keyword, String body) {
        this.keyword = keyword;
        this.body = body;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getBody() {
        return body;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
