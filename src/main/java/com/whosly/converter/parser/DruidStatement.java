package com.whosly.converter.parser;

import com.alibaba.druid.sql.ast.SQLStatement;

/**
 * A statement typed by the Druid grammar of the source dialect.
 */
public class DruidStatement extends ParsedStatement {

    private final SQLStatement statement;

    public DruidStatement(String sqlText, int startLine, int ordinal, SQLStatement statement) {
        super(sqlText, startLine, ordinal);
        this.statement = statement;
    }

    public SQLStatement getStatement() {
        return statement;
    }

    @Override
    public String describe() {
        return statement.getClass().getSimpleName();
    }
}
