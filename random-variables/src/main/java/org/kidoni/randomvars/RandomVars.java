package org.kidoni.randomvars;

import java.util.Map;

/**
 * Entry points for building and estimating random variables.
 * <pre>
 *  Variable u = uniform("u");
 *  double mean = nexpected(given(u, u.gt(0.5)), 20000);   // about 0.75
 *  double p = nprobability(u.gt(0.5), 20000);             // about 0.5
 * </pre>
 */
public abstract class RandomVars {
    public static Variable makeVariable(final Variable.Kind kind, final String name) {
        return new Variable(kind, name);
    }

    public static Variable uniform(final String name) {
        return makeVariable(Variable.Kind.UNIFORM, name);
    }

    public static Variable normal(final String name) {
        return makeVariable(Variable.Kind.NORMAL, name);
    }

    public static Constant constant(final double value) {
        return Constant.of(value);
    }

    public static Constant constant(final boolean value) {
        return Constant.of(value);
    }

    public static Given given(final Operand subject, final Operand condition) {
        return Given.of(subject, condition);
    }

    public static Constant sample(final Operand x) {
        return x.sample();
    }

    public static Operand subs(final Operand x, final Map<Variable, Constant> bindings) {
        return x.subs(bindings);
    }

    public static double nexpected(final Operand x) {
        return Estimator.defaults().expected(x);
    }

    public static double nexpected(final Operand x, final int n) {
        return Estimator.defaults().expected(x, n);
    }

    public static double nprobability(final Operand x) {
        return Estimator.defaults().probability(x);
    }

    public static double nprobability(final Operand x, final int n) {
        return Estimator.defaults().probability(x, n);
    }
}
