package com.whosly.converter.ast;

/**
 * Marker for nodes built by a grammar extension rule rather than by the base grammar.
 */
public interface ExtensionClause {

    /**
     * @return name of the rule that parses and prints this node
     */
    String getRuleName();
}
