package com.whosly.converter.grammar;

import com.whosly.converter.parser.SqlDialect;

import java.util.EnumMap;
import java.util.Map;

/**
 * One {@link DialectGrammar} per dialect, built at startup.
 */
public class GrammarRegistry {

    private final Map<SqlDialect, DialectGrammar> grammars = new EnumMap<>(SqlDialect.class);

    public GrammarRegistry() {
        for (SqlDialect dialect : SqlDialect.values()) {
            grammars.put(dialect, new DialectGrammar(dialect));
        }
    }

    /**
     * Registry with the vendor extensions every run needs, e.g. Snowflake's policy and tag clauses.
     */
    public static GrammarRegistry withDefaultExtensions() {
        GrammarRegistry registry = new GrammarRegistry();
        registry.grammarFor(SqlDialect.SNOWFLAKE).extend(new SnowflakeGrammarExtension());
        return registry;
    }

    public DialectGrammar grammarFor(SqlDialect dialect) {
        return grammars.get(dialect);
    }
}
