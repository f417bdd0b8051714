package com.whosly.converter.grammar.rules;

import com.whosly.converter.ast.DdlNode;
import com.whosly.converter.ast.ExtensionClause;
import com.whosly.converter.ast.MaskingPolicyConstraint;
import com.whosly.converter.grammar.ClauseRule;
import com.whosly.converter.grammar.ClauseScope;
import com.whosly.converter.grammar.TokenStream;
import com.whosly.converter.parser.SqlParseException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Column option {@code [WITH] MASKING POLICY name [USING (col, ...)]}.
 */
public class MaskingPolicyRule implements ClauseRule {

    @Override
    public String getName() {
        return MaskingPolicyConstraint.RULE_NAME;
    }

    @Override
    public Set<ClauseScope> getScopes() {
        return EnumSet.of(ClauseScope.COLUMN);
    }

    @Override
    public boolean matches(TokenStream tokens) {
        return tokens.isWords("WITH", "MASKING", "POLICY") || tokens.isWords("MASKING", "POLICY");
    }

    @Override
    public DdlNode parse(TokenStream tokens, ClauseScope scope) throws SqlParseException {
        boolean withKeyword = tokens.matchWords("WITH");
        tokens.expectWords("MASKING", "POLICY");
        String policyName = tokens.readQualifiedName();
        List<String> using = Collections.emptyList();
        if (tokens.matchWords("USING")) {
            using = tokens.readIdentifierList();
        }
        return new MaskingPolicyConstraint(withKeyword, policyName, using);
    }

    @Override
    public String print(ExtensionClause node) {
        MaskingPolicyConstraint policy = (MaskingPolicyConstraint) node;
        StringBuilder sb = new StringBuilder();
        if (policy.isWithKeyword()) {
            sb.append("WITH ");
        }
        sb.append("MASKING POLICY ").append(policy.getPolicyName());
        if (!policy.getUsingColumns().isEmpty()) {
            sb.append(" USING (").append(String.join(", ", policy.getUsingColumns())).append(')');
        }
        return sb.toString();
    }
}
