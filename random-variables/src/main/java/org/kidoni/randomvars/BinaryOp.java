package org.kidoni.randomvars;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class BinaryOp implements Expr {
    private final Operator operator;
    private final Operand left;
    private final Operand right;
    private final Set<Variable> variables;

    BinaryOp(final Operator operator, final Operand left, final Operand right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.variables = union(left, right);
    }

    public Operator operator() {
        return operator;
    }

    public Operand left() {
        return left;
    }

    public Operand right() {
        return right;
    }

    @Override
    public Set<Variable> variables() {
        return variables;
    }

    @Override
    public Operand subs(final Map<Variable, Constant> bindings) {
        Operand l = left.subs(bindings);
        Operand r = right.subs(bindings);
        if (l instanceof Constant lc && r instanceof Constant rc) {
            return operator.apply(lc, rc);
        }
        return new BinaryOp(operator, l, r);
    }

    // insertion ordered so that seeded sources draw variables in a stable order
    static Set<Variable> union(final Operand left, final Operand right) {
        Set<Variable> union = new LinkedHashSet<>(left.variables());
        union.addAll(right.variables());
        return Collections.unmodifiableSet(union);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinaryOp other)) {
            return false;
        }
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
