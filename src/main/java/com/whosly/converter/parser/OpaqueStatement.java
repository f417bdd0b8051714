package com.whosly.converter.parser;

/**
 * A statement the parser could not type. Downstream code treats it as plain text.
 */
public class OpaqueStatement extends ParsedStatement {

    private final String parseError;

    public OpaqueStatement(String sqlText, int startLine, int ordinal, String parseError) {
        super(sqlText, startLine, ordinal);
        this.parseError = parseError;
    }

    public String getParseError() {
        return parseError;
    }

    @Override
    public boolean isOpaque() {
        return true;
    }

    @Override
    public String describe() {
        return "OpaqueStatement";
    }
}
