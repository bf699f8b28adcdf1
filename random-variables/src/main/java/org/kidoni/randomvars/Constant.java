package org.kidoni.randomvars;

import java.util.Map;
import java.util.Set;

public sealed interface Constant extends Operand permits Constant.Num, Constant.Bool {
    static Constant of(final double value) {
        return new Num(value);
    }

    static Constant of(final boolean value) {
        return new Bool(value);
    }

    boolean truthy();

    /**
     * The numeric reading of this value; {@code true} counts as 1 and {@code false} as 0.
     */
    double doubleValue();

    @Override
    default Set<Variable> variables() {
        return Set.of();
    }

    @Override
    default Constant subs(final Map<Variable, Constant> bindings) {
        return this;
    }

    record Num(double value) implements Constant {
        @Override
        public boolean truthy() {
            return value != 0.0;
        }

        @Override
        public double doubleValue() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Bool(boolean value) implements Constant {
        @Override
        public boolean truthy() {
            return value;
        }

        @Override
        public double doubleValue() {
            return value ? 1.0 : 0.0;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }
}
