package com.whosly.converter.grammar;

/**
 * Where in a CREATE TABLE statement a clause rule is tried.
 */
public enum ClauseScope {
    /** After the element list. */
    TABLE,
    /** Among the options that follow a column's data type. */
    COLUMN
}
