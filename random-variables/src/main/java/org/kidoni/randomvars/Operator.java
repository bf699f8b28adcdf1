package org.kidoni.randomvars;

/**
 * The binary operators an expression tree can hold, with their rules for concrete values.
 * <p>
 * Arithmetic and comparisons read booleans as 1 and 0, so {@code (u > 0.5) + (v > 0.5)} counts the true
 * conditions. {@link #OR} and {@link #AND} only accept booleans.
 */
public enum Operator {
    ADD("+") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            return Constant.of(left.doubleValue() + right.doubleValue());
        }
    },
    SUB("-") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            return Constant.of(left.doubleValue() - right.doubleValue());
        }
    },
    MUL("*") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            return Constant.of(left.doubleValue() * right.doubleValue());
        }
    },
    DIV("/") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            double divisor = right.doubleValue();
            if (divisor == 0.0) {
                throw new ArithmeticException("division by zero: " + left + " / " + right);
            }
            return Constant.of(left.doubleValue() / divisor);
        }
    },
    POW("**") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            return Constant.of(Math.pow(left.doubleValue(), right.doubleValue()));
        }
    },
    LT("<") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            return Constant.of(left.doubleValue() < right.doubleValue());
        }
    },
    GT(">") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            return Constant.of(left.doubleValue() > right.doubleValue());
        }
    },
    OR("|") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            return Constant.of(bool(left, right, left) || bool(left, right, right));
        }
    },
    AND("&") {
        @Override
        public Constant apply(final Constant left, final Constant right) {
            return Constant.of(bool(left, right, left) && bool(left, right, right));
        }
    };

    private final String symbol;

    Operator(final String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Evaluates this operator on two concrete values.
     *
     * @throws TypeMismatchException if {@link #OR} or {@link #AND} is given a number
     */
    public abstract Constant apply(Constant left, Constant right);

    /**
     * Builds the node for {@code left <op> right}. A conditional operand lends its subject to the operation and
     * keeps its condition on the result; two conditional operands have their conditions joined with {@link #AND}.
     */
    public Expr combine(final Operand left, final Operand right) {
        if (left instanceof Given l && right instanceof Given r) {
            return Given.of(combine(l.subject(), r.subject()), AND.combine(l.condition(), r.condition()));
        }
        if (left instanceof Given l) {
            return Given.of(combine(l.subject(), right), l.condition());
        }
        if (right instanceof Given r) {
            return Given.of(combine(left, r.subject()), r.condition());
        }
        return new BinaryOp(this, left, right);
    }

    boolean bool(final Constant left, final Constant right, final Constant value) {
        if (value instanceof Constant.Bool bool) {
            return bool.value();
        }
        throw new TypeMismatchException(this, left, right);
    }
}
