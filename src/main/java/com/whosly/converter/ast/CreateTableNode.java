package com.whosly.converter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Root node of a CREATE TABLE statement.
 *
 * The element and clause lists are mutable; the DDL rewriter edits them in place.
 */
public class CreateTableNode extends DdlNode {

    private boolean replace;
    private final List<String> modifiers;
    private final boolean ifNotExists;
    private final String name;
    private final List<TableElement> elements;
    private final List<TableClause> clauses;

    public CreateTableNode(boolean replace, List<String> modifiers, boolean ifNotExists, String name,
                           List<TableElement> elements, List<TableClause> clauses) {
        this.replace = replace;
        this.modifiers = new ArrayList<>(modifiers);
        this.ifNotExists = ifNotExists;
        this.name = name;
        this.elements = new ArrayList<>(elements);
        this.clauses = new ArrayList<>(clauses);
    }

    public boolean isReplace() {
        return replace;
    }

    public void setReplace(boolean replace) {
        this.replace = replace;
    }

    /**
     * @return modifiers between CREATE and TABLE, upper-cased (e.g. TRANSIENT, GLOBAL TEMPORARY)
     */
    public List<String> getModifiers() {
        return modifiers;
    }

    public boolean isIfNotExists() {
        return ifNotExists;
    }

    /**
     * @return the table name as written, including qualifiers and quotes
     */
    public String getName() {
        return name;
    }

    public List<TableElement> getElements() {
        return elements;
    }

    public List<TableClause> getClauses() {
        return clauses;
    }

    public List<ColumnDefinition> getColumns() {
        List<ColumnDefinition> columns = new ArrayList<>();
        for (TableElement element : elements) {
            if (element instanceof ColumnDefinition) {
                columns.add((ColumnDefinition) element);
            }
        }
        return columns;
    }

    @Override
    public void accept(DdlNodeVisitor visitor) {
        visitor.visit(this);
    }
}
