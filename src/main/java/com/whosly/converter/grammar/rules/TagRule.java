package com.whosly.converter.grammar.rules;

import com.whosly.converter.ast.DdlNode;
import com.whosly.converter.ast.ExtensionClause;
import com.whosly.converter.ast.TagAssignment;
import com.whosly.converter.ast.TagConstraint;
import com.whosly.converter.ast.TagProperty;
import com.whosly.converter.grammar.ClauseRule;
import com.whosly.converter.grammar.ClauseScope;
import com.whosly.converter.grammar.DdlToken.TokenType;
import com.whosly.converter.grammar.TokenStream;
import com.whosly.converter.parser.SqlParseException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@code [WITH] TAG (key = 'value', ...)} on a table or on a column.
 */
public class TagRule implements ClauseRule {

    @Override
    public String getName() {
        return TagProperty.RULE_NAME;
    }

    @Override
    public Set<ClauseScope> getScopes() {
        return EnumSet.of(ClauseScope.TABLE, ClauseScope.COLUMN);
    }

    @Override
    public boolean matches(TokenStream tokens) {
        if (tokens.isWords("WITH", "TAG")) {
            return tokens.peek(2).is(TokenType.LPAREN);
        }
        return tokens.isWords("TAG") && tokens.peek(1).is(TokenType.LPAREN);
    }

    @Override
    public DdlNode parse(TokenStream tokens, ClauseScope scope) throws SqlParseException {
        boolean withKeyword = tokens.matchWords("WITH");
        tokens.expectWords("TAG");
        tokens.expect(TokenType.LPAREN);
        List<TagAssignment> tags = new ArrayList<>();
        do {
            String key = tokens.readQualifiedName();
            tokens.expect(TokenType.EQUALS);
            tags.add(new TagAssignment(key, tokens.expect(TokenType.STRING).stringValue()));
        } while (tokens.match(TokenType.COMMA));
        tokens.expect(TokenType.RPAREN);

        if (scope == ClauseScope.TABLE) {
            return new TagProperty(withKeyword, tags);
        }
        return new TagConstraint(withKeyword, tags);
    }

    @Override
    public String print(ExtensionClause node) {
        boolean withKeyword;
        List<TagAssignment> tags;
        if (node instanceof TagProperty) {
            withKeyword = ((TagProperty) node).isWithKeyword();
            tags = ((TagProperty) node).getTags();
        } else {
            withKeyword = ((TagConstraint) node).isWithKeyword();
            tags = ((TagConstraint) node).getTags();
        }

        List<String> pairs = new ArrayList<>();
        for (TagAssignment tag : tags) {
            pairs.add(tag.getKey() + " = '" + tag.getValue().replace("'", "''") + "'");
        }
        return (withKeyword ? "WITH " : "") + "TAG (" + String.join(", ", pairs) + ")";
    }
}
