package com.whosly.converter.grammar;

import java.util.List;

/**
 * A named bundle of clause rules registered on a dialect grammar in one step.
 */
public interface GrammarExtension {

    String getName();

    List<ClauseRule> getRules();
}
