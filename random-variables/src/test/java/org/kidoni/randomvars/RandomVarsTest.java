package org.kidoni.randomvars;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.kidoni.randomvars.RandomVars.constant;
import static org.kidoni.randomvars.RandomVars.given;
import static org.kidoni.randomvars.RandomVars.makeVariable;
import static org.kidoni.randomvars.RandomVars.nexpected;
import static org.kidoni.randomvars.RandomVars.nprobability;
import static org.kidoni.randomvars.RandomVars.sample;
import static org.kidoni.randomvars.RandomVars.subs;
import static org.kidoni.randomvars.RandomVars.uniform;

class RandomVarsTest {
    @Test
    void makeVariableByKind() {
        assertEquals(uniform("u"), makeVariable(Variable.Kind.UNIFORM, "u"));
        assertEquals(Variable.Kind.NORMAL, makeVariable(Variable.Kind.NORMAL, "n").kind());
    }

    @Test
    void sampleWithDefaultSampler() {
        var x = uniform("x");

        assertEquals(Constant.of(0.0), sample(x.minus(x)));
        assertEquals(Constant.of(true), sample(constant(true).or(x.gt(2))));
        assertInstanceOf(Constant.Num.class, sample(x.times(2)));
    }

    @Test
    void substitute() {
        var x = uniform("x");

        assertEquals(Constant.of(4.0), subs(x.plus(x), Map.of(x, Constant.of(2))));
    }

    @Test
    void estimateWithDefaults() {
        var u = uniform("u");

        assertEquals(0.75, nexpected(given(u, u.gt(0.5)), 20_000), 0.02);
        assertEquals(0.5, nprobability(u.gt(0.5), 20_000), 0.03);
        assertEquals(2.0, nexpected(constant(2).plus(0)));

        double p = nprobability(u.gt(0.5), 1);
        assertTrue(p == 0.0 || p == 1.0);
        assertEquals(0.5, nprobability(u.lt(0.5)), 0.1);
    }
}
