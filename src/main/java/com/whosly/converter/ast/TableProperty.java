package com.whosly.converter.ast;

/**
 * A table property: {@code name = value}, a table comment, or a vendor property such as a tag list.
 */
public abstract class TableProperty extends TableClause {
}
