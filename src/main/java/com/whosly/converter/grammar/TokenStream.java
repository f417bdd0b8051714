package com.whosly.converter.grammar;

import com.whosly.converter.grammar.DdlToken.TokenType;
import com.whosly.converter.parser.SqlParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Cursor over the tokens of one statement. Rules use it for lookahead and to slice source text.
 */
public class TokenStream {

    private final List<DdlToken> tokens;
    private final String source;
    private int index = 0;

    public TokenStream(List<DdlToken> tokens, String source) {
        this.tokens = tokens;
        this.source = source;
    }

    public static TokenStream of(String source) throws SqlParseException {
        return new TokenStream(new DdlTokenizer(source).tokenize(), source);
    }

    public DdlToken peek() {
        return peek(0);
    }

    public DdlToken peek(int ahead) {
        int i = Math.min(index + ahead, tokens.size() - 1);
        return tokens.get(i);
    }

    public DdlToken next() {
        DdlToken token = peek();
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    public DdlToken previous() {
        return tokens.get(Math.max(0, index - 1));
    }

    public boolean atEnd() {
        return peek().is(TokenType.EOF);
    }

    public boolean is(TokenType type) {
        return peek().is(type);
    }

    /**
     * @return true when the next tokens are exactly the given keywords
     */
    public boolean isWords(String... words) {
        return isWordsAt(0, words);
    }

    public boolean isWordsAt(int offset, String... words) {
        for (int i = 0; i < words.length; i++) {
            if (!peek(offset + i).isWord(words[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Consumes the keywords if all of them are next.
     */
    public boolean matchWords(String... words) {
        if (!isWords(words)) {
            return false;
        }
        index += words.length;
        return true;
    }

    public boolean match(TokenType type) {
        if (!is(type)) {
            return false;
        }
        next();
        return true;
    }

    public void expectWords(String... words) throws SqlParseException {
        for (String word : words) {
            if (!peek().isWord(word)) {
                throw unexpected("'" + word + "'");
            }
            next();
        }
    }

    public DdlToken expect(TokenType type) throws SqlParseException {
        if (!is(type)) {
            throw unexpected(type.name());
        }
        return next();
    }

    /**
     * Reads an identifier, optionally qualified with dots, and returns it as written.
     */
    public String readQualifiedName() throws SqlParseException {
        if (!peek().isIdentifier()) {
            throw unexpected("identifier");
        }
        int start = next().getStart();
        while (is(TokenType.DOT) && peek(1).isIdentifier()) {
            next();
            next();
        }
        return slice(start, previous().getEnd());
    }

    /**
     * Consumes a parenthesized group, nested groups included.
     *
     * @return the text between the outer parentheses, as written
     */
    public String readParenthesized() throws SqlParseException {
        DdlToken open = expect(TokenType.LPAREN);
        int depth = 1;
        while (depth > 0) {
            DdlToken token = next();
            if (token.is(TokenType.EOF)) {
                throw new SqlParseException("Unbalanced parentheses", open.getLine());
            }
            if (token.is(TokenType.LPAREN)) {
                depth++;
            } else if (token.is(TokenType.RPAREN)) {
                depth--;
            }
        }
        return slice(open.getEnd(), previous().getStart()).trim();
    }

    /**
     * Reads {@code (a, b, ...)} and returns the identifiers as written.
     */
    public List<String> readIdentifierList() throws SqlParseException {
        expect(TokenType.LPAREN);
        List<String> names = new ArrayList<>();
        do {
            names.add(readQualifiedName());
        } while (match(TokenType.COMMA));
        expect(TokenType.RPAREN);
        return names;
    }

    public int mark() {
        return index;
    }

    public void reset(int mark) {
        this.index = mark;
    }

    public String slice(int start, int end) {
        return source.substring(start, end);
    }

    public SqlParseException unexpected(String expected) {
        DdlToken token = peek();
        String found = token.is(TokenType.EOF) ? "end of statement" : "'" + token.getText() + "'";
        return new SqlParseException("Expected " + expected + " but found " + found, token.getLine());
    }
}
