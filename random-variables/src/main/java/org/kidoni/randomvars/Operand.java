package org.kidoni.randomvars;

import java.util.Map;
import java.util.Set;

/**
 * Either side of an operator: a concrete {@link Constant} or a symbolic {@link Expr}.
 * <p>
 * Combining operands never evaluates anything. Each operator method builds a new node with the operands in the
 * order written, so {@code Constant.of(1).minus(x)} is {@code (1.0 - x)} and {@code x.minus(1)} is
 * {@code (x - 1.0)}.
 */
public sealed interface Operand permits Constant, Expr {
    /**
     * The distinct variables reachable from this operand.
     */
    Set<Variable> variables();

    /**
     * Replaces bound variables by their values, collapsing every fully bound subtree to a {@link Constant}.
     * Variables missing from {@code bindings} stay symbolic.
     */
    Operand subs(Map<Variable, Constant> bindings);

    default Constant sample() {
        return Sampler.defaults().sample(this);
    }

    default Constant sample(final Sampler sampler) {
        return sampler.sample(this);
    }

    default Expr plus(final Operand other) {
        return Operator.ADD.combine(this, other);
    }

    default Expr plus(final double other) {
        return plus(Constant.of(other));
    }

    default Expr minus(final Operand other) {
        return Operator.SUB.combine(this, other);
    }

    default Expr minus(final double other) {
        return minus(Constant.of(other));
    }

    default Expr times(final Operand other) {
        return Operator.MUL.combine(this, other);
    }

    default Expr times(final double other) {
        return times(Constant.of(other));
    }

    default Expr div(final Operand other) {
        return Operator.DIV.combine(this, other);
    }

    default Expr div(final double other) {
        return div(Constant.of(other));
    }

    default Expr pow(final Operand other) {
        return Operator.POW.combine(this, other);
    }

    default Expr pow(final double other) {
        return pow(Constant.of(other));
    }

    default Expr lt(final Operand other) {
        return Operator.LT.combine(this, other);
    }

    default Expr lt(final double other) {
        return lt(Constant.of(other));
    }

    default Expr gt(final Operand other) {
        return Operator.GT.combine(this, other);
    }

    default Expr gt(final double other) {
        return gt(Constant.of(other));
    }

    default Expr or(final Operand other) {
        return Operator.OR.combine(this, other);
    }

    default Expr or(final boolean other) {
        return or(Constant.of(other));
    }

    default Expr and(final Operand other) {
        return Operator.AND.combine(this, other);
    }

    default Expr and(final boolean other) {
        return and(Constant.of(other));
    }

    default Given given(final Operand condition) {
        return Given.of(this, condition);
    }
}
