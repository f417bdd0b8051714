package com.whosly.converter.grammar;

import com.whosly.converter.ast.ColumnConstraint;
import com.whosly.converter.ast.ColumnDefinition;
import com.whosly.converter.ast.CommentConstraint;
import com.whosly.converter.ast.ComputedColumnConstraint;
import com.whosly.converter.ast.CreateTableNode;
import com.whosly.converter.ast.DataTypeNode;
import com.whosly.converter.ast.DdlNode;
import com.whosly.converter.ast.DdlNodeVisitor;
import com.whosly.converter.ast.DefaultConstraint;
import com.whosly.converter.ast.ExtensionClause;
import com.whosly.converter.ast.GeneratedColumnConstraint;
import com.whosly.converter.ast.GroupingClause;
import com.whosly.converter.ast.IdentityConstraint;
import com.whosly.converter.ast.NamedProperty;
import com.whosly.converter.ast.NullabilityConstraint;
import com.whosly.converter.ast.RawConstraint;
import com.whosly.converter.ast.RawTableElement;
import com.whosly.converter.ast.TableClause;
import com.whosly.converter.ast.TableCommentProperty;
import com.whosly.converter.ast.TableElement;

import java.util.List;

/**
 * Renders a CREATE TABLE AST. One element per line and one table clause per line.
 */
class DdlPrinter implements DdlNodeVisitor {

    private final DialectGrammar grammar;
    private final StringBuilder out = new StringBuilder();

    DdlPrinter(DialectGrammar grammar) {
        this.grammar = grammar;
    }

    String print(CreateTableNode table) {
        out.setLength(0);
        table.accept(this);
        return out.toString();
    }

    String printNode(DdlNode node) {
        out.setLength(0);
        node.accept(this);
        return out.toString();
    }

    static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    @Override
    public void visit(CreateTableNode table) {
        out.append("CREATE ");
        if (table.isReplace()) {
            out.append("OR REPLACE ");
        }
        for (String modifier : table.getModifiers()) {
            out.append(modifier).append(' ');
        }
        out.append("TABLE ");
        if (table.isIfNotExists()) {
            out.append("IF NOT EXISTS ");
        }
        out.append(table.getName()).append(" (\n");
        List<TableElement> elements = table.getElements();
        for (int i = 0; i < elements.size(); i++) {
            out.append("  ");
            elements.get(i).accept(this);
            if (i < elements.size() - 1) {
                out.append(',');
            }
            out.append('\n');
        }
        out.append(')');
        for (TableClause clause : table.getClauses()) {
            out.append('\n');
            clause.accept(this);
        }
    }

    @Override
    public void visit(ColumnDefinition column) {
        out.append(column.getName()).append(' ');
        column.getDataType().accept(this);
        for (ColumnConstraint constraint : column.getConstraints()) {
            out.append(' ');
            constraint.accept(this);
        }
    }

    @Override
    public void visit(DataTypeNode dataType) {
        out.append(dataType);
    }

    @Override
    public void visit(RawTableElement element) {
        out.append(element.getText());
    }

    @Override
    public void visit(CommentConstraint constraint) {
        out.append("COMMENT ").append(quote(constraint.getText()));
    }

    @Override
    public void visit(NullabilityConstraint constraint) {
        out.append(constraint.isNullable() ? "NULL" : "NOT NULL");
    }

    @Override
    public void visit(DefaultConstraint constraint) {
        out.append("DEFAULT ").append(constraint.getExpression());
    }

    @Override
    public void visit(ComputedColumnConstraint constraint) {
        out.append("AS (").append(constraint.getExpression()).append(')');
    }

    @Override
    public void visit(GeneratedColumnConstraint constraint) {
        out.append("GENERATED ALWAYS AS (").append(constraint.getExpression()).append(") VIRTUAL");
    }

    @Override
    public void visit(IdentityConstraint constraint) {
        out.append(constraint.getText());
    }

    @Override
    public void visit(RawConstraint constraint) {
        out.append(constraint.getText());
    }

    @Override
    public void visit(GroupingClause clause) {
        out.append(clause.getKeyword()).append(' ').append(clause.getBody());
    }

    @Override
    public void visit(TableCommentProperty property) {
        out.append("COMMENT = ").append(quote(property.getText()));
    }

    @Override
    public void visit(NamedProperty property) {
        out.append(property.getName());
        if (property.getValue() != null) {
            out.append(" = ").append(property.getValue());
        }
    }

    @Override
    public void visitExtension(ExtensionClause node) {
        out.append(grammar.printExtension(node));
    }
}
