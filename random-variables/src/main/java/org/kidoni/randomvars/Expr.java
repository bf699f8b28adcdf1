package org.kidoni.randomvars;

/**
 * A symbolic node: a {@link Variable}, an operator applied to two operands, or a conditional value.
 * Nodes are immutable and may be shared between trees.
 */
public sealed interface Expr extends Operand permits Variable, BinaryOp, Given {
}
