package com.whosly.converter.grammar;

import com.whosly.converter.ast.ColumnConstraint;
import com.whosly.converter.ast.ColumnDefinition;
import com.whosly.converter.ast.CommentConstraint;
import com.whosly.converter.ast.ComputedColumnConstraint;
import com.whosly.converter.ast.CreateTableNode;
import com.whosly.converter.ast.DataTypeNode;
import com.whosly.converter.ast.DdlNode;
import com.whosly.converter.ast.DefaultConstraint;
import com.whosly.converter.ast.GroupingClause;
import com.whosly.converter.ast.IdentityConstraint;
import com.whosly.converter.ast.NamedProperty;
import com.whosly.converter.ast.NullabilityConstraint;
import com.whosly.converter.ast.RawConstraint;
import com.whosly.converter.ast.RawTableElement;
import com.whosly.converter.ast.TableClause;
import com.whosly.converter.ast.TableCommentProperty;
import com.whosly.converter.ast.TableElement;
import com.whosly.converter.grammar.DdlToken.TokenType;
import com.whosly.converter.parser.SqlParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for CREATE TABLE. One instance parses one statement.
 *
 * Vendor clauses are tried first through the rules registered on the {@link DialectGrammar}.
 */
class CreateTableGrammar {

    private static final Set<String> TABLE_MODIFIERS = Set.of(
            "LOCAL", "GLOBAL", "TEMPORARY", "TEMP", "VOLATILE", "TRANSIENT");

    // words that end an unparenthesized DEFAULT / AS expression
    private static final Set<String> EXPRESSION_STOP_WORDS = Set.of(
            "NOT", "NULL", "COMMENT", "CONSTRAINT", "PRIMARY", "UNIQUE", "REFERENCES", "CHECK",
            "COLLATE", "WITH", "TAG", "MASKING", "AUTOINCREMENT", "AUTO_INCREMENT", "IDENTITY", "GENERATED");

    private static final Set<String> CLAUSE_START_WORDS = Set.of("CLUSTER", "PARTITION", "COMMENT", "COPY", "WITH", "TAG");

    private final TokenStream tokens;
    private final DialectGrammar grammar;

    CreateTableGrammar(TokenStream tokens, DialectGrammar grammar) {
        this.tokens = tokens;
        this.grammar = grammar;
    }

    CreateTableNode parseCreateTable() throws SqlParseException {
        tokens.expectWords("CREATE");
        boolean replace = tokens.matchWords("OR", "REPLACE");
        List<String> modifiers = new ArrayList<>();
        while (tokens.is(TokenType.WORD) && TABLE_MODIFIERS.contains(upper(tokens.peek()))) {
            modifiers.add(upper(tokens.next()));
        }
        tokens.expectWords("TABLE");
        boolean ifNotExists = tokens.matchWords("IF", "NOT", "EXISTS");
        String name = tokens.readQualifiedName();
        if (!tokens.is(TokenType.LPAREN)) {
            throw tokens.unexpected("column list");
        }
        List<TableElement> elements = parseElements();
        List<TableClause> clauses = parseTableClauses();
        tokens.match(TokenType.SEMICOLON);
        if (!tokens.atEnd()) {
            throw tokens.unexpected("end of statement");
        }
        return new CreateTableNode(replace, modifiers, ifNotExists, name, elements, clauses);
    }

    DataTypeNode parseStandaloneDataType() throws SqlParseException {
        DataTypeNode type = parseDataType();
        if (!tokens.atEnd()) {
            throw tokens.unexpected("end of type");
        }
        return type;
    }

    private List<TableElement> parseElements() throws SqlParseException {
        tokens.expect(TokenType.LPAREN);
        List<TableElement> elements = new ArrayList<>();
        do {
            elements.add(parseElement());
        } while (tokens.match(TokenType.COMMA));
        tokens.expect(TokenType.RPAREN);
        return elements;
    }

    private TableElement parseElement() throws SqlParseException {
        if (isTableConstraintStart()) {
            int start = tokens.peek().getStart();
            skipToElementEnd();
            return new RawTableElement(tokens.slice(start, tokens.previous().getEnd()));
        }
        if (!tokens.peek().isIdentifier()) {
            throw tokens.unexpected("column name");
        }
        String name = tokens.next().getText();
        DataTypeNode type = parseDataType();
        List<ColumnConstraint> constraints = new ArrayList<>();
        while (!tokens.is(TokenType.COMMA) && !tokens.is(TokenType.RPAREN) && !tokens.atEnd()) {
            constraints.add(parseColumnOption());
        }
        return new ColumnDefinition(name, type, constraints);
    }

    private boolean isTableConstraintStart() {
        if (tokens.isWords("CONSTRAINT") || tokens.isWords("PRIMARY", "KEY") || tokens.isWords("FOREIGN", "KEY")) {
            return true;
        }
        return (tokens.isWords("UNIQUE") || tokens.isWords("CHECK")) && tokens.peek(1).is(TokenType.LPAREN);
    }

    private void skipToElementEnd() {
        int depth = 0;
        while (!tokens.atEnd()) {
            DdlToken token = tokens.peek();
            if (depth == 0 && (token.is(TokenType.COMMA) || token.is(TokenType.RPAREN))) {
                return;
            }
            if (token.is(TokenType.LPAREN)) {
                depth++;
            } else if (token.is(TokenType.RPAREN)) {
                depth--;
            }
            tokens.next();
        }
    }

    DataTypeNode parseDataType() throws SqlParseException {
        if (!tokens.is(TokenType.WORD)) {
            throw tokens.unexpected("data type");
        }
        String base = upper(tokens.next());
        StringBuilder name = new StringBuilder(base);
        switch (base) {
            case "DOUBLE":
                if (tokens.matchWords("PRECISION")) {
                    name.append(" PRECISION");
                }
                break;
            case "CHARACTER":
            case "CHAR":
            case "NCHAR":
                if (tokens.matchWords("VARYING")) {
                    name.append(" VARYING");
                }
                break;
            case "LONG":
                if (tokens.matchWords("RAW")) {
                    name.append(" RAW");
                }
                break;
            default:
                break;
        }

        List<String> arguments = new ArrayList<>();
        if (tokens.is(TokenType.LPAREN)) {
            arguments = parseTypeArguments();
        }
        if (base.equals("TIMESTAMP") || base.equals("TIME")) {
            // TIMESTAMP(9) WITH LOCAL TIME ZONE keeps its precision on the node
            if (tokens.matchWords("WITH", "LOCAL", "TIME", "ZONE")) {
                name.append(" WITH LOCAL TIME ZONE");
            } else if (tokens.matchWords("WITH", "TIME", "ZONE")) {
                name.append(" WITH TIME ZONE");
            } else if (tokens.matchWords("WITHOUT", "TIME", "ZONE")) {
                name.append(" WITHOUT TIME ZONE");
            }
            if (arguments.isEmpty() && tokens.is(TokenType.LPAREN)) {
                arguments = parseTypeArguments();
            }
        }
        return new DataTypeNode(name.toString(), arguments);
    }

    private List<String> parseTypeArguments() throws SqlParseException {
        DdlToken open = tokens.expect(TokenType.LPAREN);
        List<String> arguments = new ArrayList<>();
        int argStart = open.getEnd();
        int depth = 0;
        while (true) {
            DdlToken token = tokens.next();
            if (token.is(TokenType.EOF)) {
                throw new SqlParseException("Unterminated type arguments", open.getLine());
            }
            if (token.is(TokenType.LPAREN)) {
                depth++;
            } else if (token.is(TokenType.RPAREN) && depth > 0) {
                depth--;
            } else if (depth == 0 && (token.is(TokenType.COMMA) || token.is(TokenType.RPAREN))) {
                String argument = tokens.slice(argStart, token.getStart()).trim();
                if (!argument.isEmpty()) {
                    arguments.add(argument);
                }
                if (token.is(TokenType.RPAREN)) {
                    return arguments;
                }
                argStart = token.getEnd();
            }
        }
    }

    private ColumnConstraint parseColumnOption() throws SqlParseException {
        for (ClauseRule rule : grammar.getRules(ClauseScope.COLUMN)) {
            if (rule.matches(tokens)) {
                DdlNode node = rule.parse(tokens, ClauseScope.COLUMN);
                if (!(node instanceof ColumnConstraint)) {
                    throw new IllegalStateException("Rule " + rule.getName() + " did not build a column option");
                }
                return (ColumnConstraint) node;
            }
        }

        int start = tokens.peek().getStart();
        if (tokens.matchWords("COMMENT")) {
            tokens.match(TokenType.EQUALS);
            return new CommentConstraint(tokens.expect(TokenType.STRING).stringValue());
        }
        if (tokens.matchWords("NOT", "NULL")) {
            return new NullabilityConstraint(false);
        }
        if (tokens.matchWords("NULL")) {
            return new NullabilityConstraint(true);
        }
        if (tokens.matchWords("DEFAULT")) {
            return new DefaultConstraint(readExpression());
        }
        if (tokens.matchWords("AS")) {
            String expression = tokens.is(TokenType.LPAREN) ? tokens.readParenthesized() : readExpression();
            return new ComputedColumnConstraint(expression);
        }
        if (tokens.isWords("GENERATED")) {
            return parseGenerated(start);
        }
        if (tokens.isWords("AUTOINCREMENT") || tokens.isWords("AUTO_INCREMENT") || tokens.isWords("IDENTITY")) {
            return parseIdentity(start);
        }
        if (tokens.matchWords("COLLATE")) {
            tokens.next();
            return raw(start);
        }
        if (tokens.matchWords("PRIMARY", "KEY") || tokens.matchWords("UNIQUE")) {
            return raw(start);
        }
        if (tokens.matchWords("REFERENCES")) {
            tokens.readQualifiedName();
            if (tokens.is(TokenType.LPAREN)) {
                tokens.readParenthesized();
            }
            return raw(start);
        }
        if (tokens.matchWords("CHECK")) {
            tokens.readParenthesized();
            return raw(start);
        }
        if (tokens.matchWords("CONSTRAINT")) {
            tokens.readQualifiedName();
            parseColumnOption();
            return raw(start);
        }
        if (tokens.isWords("WITH")) {
            throw tokens.unexpected("column option");
        }

        // unknown option: keep the word and its argument list as written
        tokens.next();
        if (tokens.is(TokenType.LPAREN)) {
            tokens.readParenthesized();
        }
        return raw(start);
    }

    private ColumnConstraint parseGenerated(int start) throws SqlParseException {
        tokens.expectWords("GENERATED");
        if (!tokens.matchWords("ALWAYS") && tokens.matchWords("BY", "DEFAULT")) {
            tokens.matchWords("ON", "NULL");
        }
        tokens.expectWords("AS");
        if (tokens.matchWords("IDENTITY")) {
            if (tokens.is(TokenType.LPAREN)) {
                tokens.readParenthesized();
            }
            return new IdentityConstraint(tokens.slice(start, tokens.previous().getEnd()));
        }
        String expression = tokens.readParenthesized();
        if (!tokens.matchWords("VIRTUAL")) {
            tokens.matchWords("STORED");
        }
        return new ComputedColumnConstraint(expression);
    }

    private ColumnConstraint parseIdentity(int start) throws SqlParseException {
        tokens.next();
        if (tokens.is(TokenType.LPAREN)) {
            tokens.readParenthesized();
        }
        while (true) {
            if (tokens.matchWords("START")) {
                tokens.matchWords("WITH");
                tokens.match(TokenType.EQUALS);
                readSignedNumber();
            } else if (tokens.matchWords("INCREMENT")) {
                tokens.matchWords("BY");
                tokens.match(TokenType.EQUALS);
                readSignedNumber();
            } else if (!tokens.matchWords("ORDER") && !tokens.matchWords("NOORDER")) {
                break;
            }
        }
        return new IdentityConstraint(tokens.slice(start, tokens.previous().getEnd()));
    }

    private void readSignedNumber() throws SqlParseException {
        if (tokens.is(TokenType.SYMBOL) && (tokens.peek().getText().equals("-") || tokens.peek().getText().equals("+"))) {
            tokens.next();
        }
        tokens.expect(TokenType.NUMBER);
    }

    private String readExpression() throws SqlParseException {
        int start = tokens.peek().getStart();
        int depth = 0;
        boolean first = true;
        while (!tokens.atEnd()) {
            DdlToken token = tokens.peek();
            if (depth == 0) {
                if (token.is(TokenType.COMMA) || token.is(TokenType.RPAREN) || token.is(TokenType.SEMICOLON)) {
                    break;
                }
                if (!first && token.is(TokenType.WORD) && EXPRESSION_STOP_WORDS.contains(upper(token))) {
                    break;
                }
            }
            if (token.is(TokenType.LPAREN)) {
                depth++;
            } else if (token.is(TokenType.RPAREN)) {
                depth--;
            }
            tokens.next();
            first = false;
        }
        if (first) {
            throw tokens.unexpected("expression");
        }
        return tokens.slice(start, tokens.previous().getEnd()).trim();
    }

    private List<TableClause> parseTableClauses() throws SqlParseException {
        List<TableClause> clauses = new ArrayList<>();
        while (!tokens.atEnd() && !tokens.is(TokenType.SEMICOLON)) {
            clauses.add(parseTableClause());
        }
        return clauses;
    }

    private TableClause parseTableClause() throws SqlParseException {
        for (ClauseRule rule : grammar.getRules(ClauseScope.TABLE)) {
            if (rule.matches(tokens)) {
                DdlNode node = rule.parse(tokens, ClauseScope.TABLE);
                if (!(node instanceof TableClause)) {
                    throw new IllegalStateException("Rule " + rule.getName() + " did not build a table clause");
                }
                return (TableClause) node;
            }
        }

        if (tokens.matchWords("CLUSTER", "BY")) {
            int bodyStart = tokens.peek().getStart();
            tokens.matchWords("LINEAR");
            tokens.readParenthesized();
            return new GroupingClause("CLUSTER BY", tokens.slice(bodyStart, tokens.previous().getEnd()));
        }
        if (tokens.matchWords("PARTITION", "BY")) {
            int bodyStart = tokens.peek().getStart();
            readClauseBody();
            return new GroupingClause("PARTITION BY", tokens.slice(bodyStart, tokens.previous().getEnd()));
        }
        if (tokens.matchWords("COMMENT")) {
            tokens.match(TokenType.EQUALS);
            return new TableCommentProperty(tokens.expect(TokenType.STRING).stringValue());
        }
        if (tokens.matchWords("COPY", "GRANTS")) {
            return new NamedProperty("COPY GRANTS", null);
        }
        if (tokens.is(TokenType.WORD) && tokens.peek(1).is(TokenType.EQUALS)) {
            String name = upper(tokens.next());
            tokens.next();
            if (tokens.atEnd()) {
                throw tokens.unexpected("property value");
            }
            int valueStart = tokens.peek().getStart();
            if (tokens.is(TokenType.LPAREN)) {
                tokens.readParenthesized();
            } else {
                tokens.next();
            }
            return new NamedProperty(name, tokens.slice(valueStart, tokens.previous().getEnd()));
        }
        throw tokens.unexpected("table clause");
    }

    private void readClauseBody() throws SqlParseException {
        boolean first = true;
        while (!tokens.atEnd() && !tokens.is(TokenType.SEMICOLON)) {
            DdlToken token = tokens.peek();
            if (!first && token.is(TokenType.WORD)
                    && (CLAUSE_START_WORDS.contains(upper(token)) || tokens.peek(1).is(TokenType.EQUALS))) {
                return;
            }
            if (token.is(TokenType.LPAREN)) {
                tokens.readParenthesized();
            } else {
                tokens.next();
            }
            first = false;
        }
        if (first) {
            throw tokens.unexpected("clause body");
        }
    }

    private ColumnConstraint raw(int start) {
        return new RawConstraint(tokens.slice(start, tokens.previous().getEnd()));
    }

    private static String upper(DdlToken token) {
        return token.getText().toUpperCase(Locale.ROOT);
    }
}
