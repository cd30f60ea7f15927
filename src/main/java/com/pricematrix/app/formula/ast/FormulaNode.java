package com.pricematrix.app.formula.ast;

/**
 * Root of the parsed formula tree. Nodes are immutable and never hold live cell
 * objects; references are plain coordinates resolved at evaluation time.
 */
public abstract class FormulaNode {

    public abstract <R> R accept(FormulaVisitor<R> visitor);
}
