package com.formulagrid.app.formula.ast;

/**
 * A node of a parsed formula. Nodes are immutable; editing a formula
 * always produces a new tree.
 * <p>
 * The set of node kinds is closed: consumers dispatch through
 * {@link AstVisitor}, so a new kind cannot be added without every
 * consumer handling it.
 */
public interface FormulaAst {

    <R> R accept(AstVisitor<R> visitor);
}
