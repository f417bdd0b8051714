package com.whosly.converter.parser;

/**
 * One statement of a script: a parsed node plus the text it was parsed from.
 *
 * Ordering within a file is significant; {@link #getOrdinal()} keeps it.
 */
public abstract class ParsedStatement {

    private final String sqlText;
    private final int startLine;
    private final int ordinal;

    protected ParsedStatement(String sqlText, int startLine, int ordinal) {
        this.sqlText = sqlText;
        this.startLine = startLine;
        this.ordinal = ordinal;
    }

    /**
     * @return the raw source text, without the statement terminator
     */
    public String getSqlText() {
        return sqlText;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getOrdinal() {
        return ordinal;
    }

    /**
     * @return true when the parser could not build a typed node for this statement
     */
    public boolean isOpaque() {
        return false;
    }

    /**
     * @return short description used in logs
     */
    public abstract String describe();
}
