package com.whosly.converter.parser;

import com.whosly.converter.ast.CreateTableNode;

/**
 * A CREATE TABLE statement typed by the dialect's CREATE TABLE grammar.
 */
public class CreateTableStatement extends ParsedStatement {

    private final CreateTableNode table;

    public CreateTableStatement(String sqlText, int startLine, int ordinal, CreateTableNode table) {
        super(sqlText, startLine, ordinal);
        this.table = table;
    }

    public CreateTableNode getTable() {
        return table;
    }

    @Override
    public String describe() {
        return "CreateTable " + table.getName();
    }
}
