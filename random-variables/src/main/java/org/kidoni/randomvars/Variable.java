package org.kidoni.randomvars;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named elementary random source. Two variables of the same kind and name are the same variable, however many
 * times they are constructed, and receive a single draw per sample.
 */
public record Variable(Kind kind, String name) implements Expr {
    public enum Kind {
        UNIFORM {
            @Override
            double draw(final RandomSource source) {
                return source.uniform();
            }
        },
        NORMAL {
            @Override
            double draw(final RandomSource source) {
                return source.standardNormal();
            }
        };

        abstract double draw(RandomSource source);
    }

    public Variable {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    public Constant draw(final RandomSource source) {
        return Constant.of(kind.draw(source));
    }

    @Override
    public Set<Variable> variables() {
        return Set.of(this);
    }

    @Override
    public Operand subs(final Map<Variable, Constant> bindings) {
        Constant value = bindings.get(this);
        return value != null ? value : this;
    }

    @Override
    public String toString() {
        return name;
    }
}
