package com.whosly.converter.ast;

/**
 * An option written after a column's data type.
 */
public abstract class ColumnConstraint extends DdlNode {
}
