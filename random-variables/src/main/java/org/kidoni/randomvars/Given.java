package org.kidoni.randomvars;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A subject restricted to the outcomes where a condition holds. Sampling draws subject and condition jointly and
 * rejects draws until the condition is truthy, see {@link Sampler}.
 * <p>
 * Conditioning never nests: the subject and the condition of a {@code Given} are never themselves conditional.
 * {@code given(given(a, b), c)} is built as {@code given(a, b & c)}.
 */
public final class Given implements Expr {
    private final Operand subject;
    private final Operand condition;
    private final Set<Variable> variables;

    private Given(final Operand subject, final Operand condition) {
        this.subject = subject;
        this.condition = condition;
        this.variables = BinaryOp.union(subject, condition);
    }

    public static Given of(final Operand subject, final Operand condition) {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(condition, "condition");

        Operand accepted = condition;
        if (accepted instanceof Given inner) {
            accepted = Operator.AND.combine(inner.subject, inner.condition);
        }
        if (subject instanceof Given inner) {
            return new Given(inner.subject, Operator.AND.combine(inner.condition, accepted));
        }
        return new Given(subject, accepted);
    }

    public Operand subject() {
        return subject;
    }

    public Operand condition() {
        return condition;
    }

    @Override
    public Set<Variable> variables() {
        return variables;
    }

    /**
     * Substitutes into subject and condition. The result stays conditional even when both sides are bound; only
     * sampling decides whether the condition accepts.
     */
    @Override
    public Given subs(final Map<Variable, Constant> bindings) {
        return new Given(subject.subs(bindings), condition.subs(bindings));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Given other)) {
            return false;
        }
        return subject.equals(other.subject) && condition.equals(other.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, condition);
    }

    @Override
    public String toString() {
        return "{ " + subject + " ; " + condition + " }";
    }
}
