package com.whosly.converter.parser;

import com.whosly.converter.ast.CreateTableNode;

import java.util.List;

/**
 * Interface for SQL parsing functionality.
 *
 * Script parsing is lenient: statements that cannot be typed come back as {@link OpaqueStatement}s.
 */
public interface SqlParser {

    /**
     * Parse a whole script into statements, in source order.
     *
     * @param script the script text
     * @return one parsed statement per top-level statement; never throws for bad SQL
     */
    List<ParsedStatement> parseScript(String script);

    /**
     * Parse one statement leniently.
     *
     * @param sql       statement text without its terminator
     * @param startLine 1-based line the statement starts on
     * @param ordinal   position of the statement in its script
     * @return a typed statement, or an opaque one when parsing failed
     */
    ParsedStatement parseStatement(String sql, int startLine, int ordinal);

    /**
     * Parse a CREATE TABLE statement strictly.
     *
     * @param sql the statement text
     * @return the table node
     * @throws SqlParseException if the text cannot be parsed as CREATE TABLE
     */
    CreateTableNode parseCreateTable(String sql) throws SqlParseException;

    SqlDialect getDialect();
}
