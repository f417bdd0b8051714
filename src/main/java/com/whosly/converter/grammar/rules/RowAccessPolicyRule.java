package com.whosly.converter.grammar.rules;

import com.whosly.converter.ast.DdlNode;
import com.whosly.converter.ast.ExtensionClause;
import com.whosly.converter.ast.RowAccessPolicyProperty;
import com.whosly.converter.grammar.ClauseRule;
import com.whosly.converter.grammar.ClauseScope;
import com.whosly.converter.grammar.TokenStream;
import com.whosly.converter.parser.SqlParseException;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@code [WITH] ROW ACCESS POLICY name ON (col, ...)} after the column list.
 */
public class RowAccessPolicyRule implements ClauseRule {

    @Override
    public String getName() {
        return RowAccessPolicyProperty.RULE_NAME;
    }

    @Override
    public Set<ClauseScope> getScopes() {
        return EnumSet.of(ClauseScope.TABLE);
    }

    @Override
    public boolean matches(TokenStream tokens) {
        return tokens.isWords("WITH", "ROW", "ACCESS", "POLICY") || tokens.isWords("ROW", "ACCESS", "POLICY");
    }

    @Override
    public DdlNode parse(TokenStream tokens, ClauseScope scope) throws SqlParseException {
        tokens.matchWords("WITH");
        tokens.expectWords("ROW", "ACCESS", "POLICY");
        String policyName = tokens.readQualifiedName();
        tokens.expectWords("ON");
        List<String> columns = tokens.readIdentifierList();
        return new RowAccessPolicyProperty(policyName, columns);
    }

    @Override
    public String print(ExtensionClause node) {
        RowAccessPolicyProperty policy = (RowAccessPolicyProperty) node;
        return "WITH ROW ACCESS POLICY " + policy.getPolicyName()
                + " ON (" + String.join(", ", policy.getColumns()) + ")";
    }
}
