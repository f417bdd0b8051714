package com.whosly.converter.ast;

/**
 * An entry of the parenthesized element list: a column or a table constraint.
 */
public abstract class TableElement extends DdlNode {
}
