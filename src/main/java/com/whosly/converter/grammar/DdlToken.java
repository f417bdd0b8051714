package com.whosly.converter.grammar;

/**
 * A token of DDL source text. Offsets index into the original statement text.
 */
public class DdlToken {

    public enum TokenType {
        WORD,
        QUOTED_IDENTIFIER,
        STRING,
        NUMBER,
        LPAREN,
        RPAREN,
        COMMA,
        DOT,
        EQUALS,
        SEMICOLON,
        SYMBOL,
        EOF
    }

    private final TokenType type;
    private final String text;
    private final int start;
    private final int end;
    private final int line;

    public DdlToken(TokenType type, String text, int start, int end, int line) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
        this.line = line;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLine() {
        return line;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Case-insensitive keyword check. Quoted identifiers never match.
     */
    public boolean isWord(String keyword) {
        return type == TokenType.WORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isIdentifier() {
        return type == TokenType.WORD || type == TokenType.QUOTED_IDENTIFIER;
    }

    /**
     * @return the literal value of a STRING token with quotes removed and {@code ''} unescaped
     */
    public String stringValue() {
        if (text.startsWith("$$")) {
            return text.substring(2, text.length() - 2);
        }
        return text.substring(1, text.length() - 1).replace("''", "'");
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line;
    }
}
