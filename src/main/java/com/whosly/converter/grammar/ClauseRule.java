package com.whosly.converter.grammar;

import com.whosly.converter.ast.DdlNode;
import com.whosly.converter.ast.ExtensionClause;
import com.whosly.converter.parser.SqlParseException;

import java.util.Set;

/**
 * A vendor clause the base CREATE TABLE grammar does not know: one parse hook and one print hook.
 */
public interface ClauseRule {

    /**
     * Rule name, matched against {@link ExtensionClause#getRuleName()} when printing.
     */
    String getName();

    Set<ClauseScope> getScopes();

    /**
     * Lookahead only; must not consume tokens.
     *
     * @param tokens stream positioned where a clause may start
     * @return true if this rule recognizes the upcoming keyword sequence
     */
    boolean matches(TokenStream tokens);

    /**
     * Consumes the clause and builds its node.
     *
     * @param tokens stream positioned at the clause
     * @param scope  scope in which the clause was found
     * @return a {@code TableClause} for TABLE scope or a {@code ColumnConstraint} for COLUMN scope
     * @throws SqlParseException if the clause is malformed
     */
    DdlNode parse(TokenStream tokens, ClauseScope scope) throws SqlParseException;

    /**
     * Renders a node built by {@link #parse} back into source text.
     */
    String print(ExtensionClause node);
}
