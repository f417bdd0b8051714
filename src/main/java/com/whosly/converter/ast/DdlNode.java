package com.whosly.converter.ast;

/**
 * Base class for all CREATE TABLE AST nodes.
 */
public abstract class DdlNode {

    public abstract void accept(DdlNodeVisitor visitor);
}
