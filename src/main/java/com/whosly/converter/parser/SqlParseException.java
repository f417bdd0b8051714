package com.whosly.converter.parser;

/**
 * Exception thrown when SQL parsing fails.
 */
public class SqlParseException extends Exception {

    private final int line;

    public SqlParseException(String message) {
        this(message, -1);
    }

    public SqlParseException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    public SqlParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
    }

    /**
     * @return 1-based line of the offending token, or -1 when unknown
     */
    public int getLine() {
        return line;
    }
}
