package com.whosly.converter.grammar;

import com.whosly.converter.grammar.DdlToken.TokenType;
import com.whosly.converter.parser.SqlParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for CREATE TABLE statements and type strings.
 */
public class DdlTokenizer {

    private static final String[] OPERATORS = {"::", "||", "<=", ">=", "<>", "!=", "=>", "->"};

    private final String source;
    private int pos = 0;
    private int line = 1;

    public DdlTokenizer(String source) {
        this.source = source;
    }

    public List<DdlToken> tokenize() throws SqlParseException {
        List<DdlToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new DdlToken(TokenType.EOF, "", pos, pos, line));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private DdlToken nextToken() throws SqlParseException {
        int start = pos;
        int startLine = line;
        char c = source.charAt(pos);

        if (c == '\'') {
            return readQuoted('\'', TokenType.STRING, start, startLine);
        }
        if (c == '"') {
            return readQuoted('"', TokenType.QUOTED_IDENTIFIER, start, startLine);
        }
        if (c == '$' && source.startsWith("$$", pos)) {
            int close = source.indexOf("$$", pos + 2);
            if (close < 0) {
                throw new SqlParseException("Unterminated $$ literal", startLine);
            }
            advanceTo(close + 2);
            return token(TokenType.STRING, start, startLine);
        }
        if (Character.isDigit(c)) {
            while (pos < source.length()
                    && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
                pos++;
            }
            return token(TokenType.NUMBER, start, startLine);
        }
        if (isWordStart(c)) {
            while (pos < source.length() && isWordPart(source.charAt(pos))) {
                pos++;
            }
            return token(TokenType.WORD, start, startLine);
        }

        switch (c) {
            case '(':
                pos++;
                return token(TokenType.LPAREN, start, startLine);
            case ')':
                pos++;
                return token(TokenType.RPAREN, start, startLine);
            case ',':
                pos++;
                return token(TokenType.COMMA, start, startLine);
            case '.':
                pos++;
                return token(TokenType.DOT, start, startLine);
            case ';':
                pos++;
                return token(TokenType.SEMICOLON, start, startLine);
            default:
                break;
        }

        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                return token(TokenType.SYMBOL, start, startLine);
            }
        }
        pos++;
        return token(c == '=' ? TokenType.EQUALS : TokenType.SYMBOL, start, startLine);
    }

    private DdlToken readQuoted(char quote, TokenType type, int start, int startLine) throws SqlParseException {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == quote) {
                // doubled quote is an escaped quote
                if (pos + 1 < source.length() && source.charAt(pos + 1) == quote) {
                    pos += 2;
                    continue;
                }
                pos++;
                return token(type, start, startLine);
            }
            if (c == '\n') {
                line++;
            }
            pos++;
        }
        throw new SqlParseException("Unterminated quoted text", startLine);
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (source.startsWith("--", pos) || source.startsWith("//", pos)) {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (source.startsWith("/*", pos)) {
                int close = source.indexOf("*/", pos + 2);
                advanceTo(close < 0 ? source.length() : close + 2);
            } else {
                return;
            }
        }
    }

    private void advanceTo(int target) {
        while (pos < target) {
            if (source.charAt(pos) == '\n') {
                line++;
            }
            pos++;
        }
    }

    private DdlToken token(TokenType type, int start, int startLine) {
        return new DdlToken(type, source.substring(start, pos), start, pos, startLine);
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
