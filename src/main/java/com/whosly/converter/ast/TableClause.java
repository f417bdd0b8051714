package com.whosly.converter.ast;

/**
 * A clause that follows the element list of CREATE TABLE.
 */
public abstract class TableClause extends DdlNode {
}
