package com.whosly.converter.grammar;

import com.whosly.converter.grammar.rules.MaskingPolicyRule;
import com.whosly.converter.grammar.rules.RowAccessPolicyRule;
import com.whosly.converter.grammar.rules.TagRule;

import java.util.Arrays;
import java.util.List;

/**
 * Snowflake clauses: row access policies, tags and masking policies.
 */
public class SnowflakeGrammarExtension implements GrammarExtension {

    public static final String NAME = "snowflake-governance";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<ClauseRule> getRules() {
        return Arrays.asList(new RowAccessPolicyRule(), new TagRule(), new MaskingPolicyRule());
    }
}
