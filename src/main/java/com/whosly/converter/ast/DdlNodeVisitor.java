package com.whosly.converter.ast;

/**
 * Visitor pattern interface for traversing the CREATE TABLE AST.
 */
public interface DdlNodeVisitor {
    void visit(CreateTableNode table);
    void visit(ColumnDefinition column);
    void visit(DataTypeNode dataType);
    void visit(RawTableElement element);
    void visit(CommentConstraint constraint);
    void visit(NullabilityConstraint constraint);
    void visit(DefaultConstraint constraint);
    void visit(ComputedColumnConstraint constraint);
    void visit(GeneratedColumnConstraint constraint);
    void visit(IdentityConstraint constraint);
    void visit(RawConstraint constraint);
    void visit(GroupingClause clause);
    void visit(TableCommentProperty property);
    void visit(NamedProperty property);

    /**
     * Nodes contributed by a grammar extension. The printer hands them back to the rule that built them.
     */
    void visitExtension(ExtensionClause node);
}
