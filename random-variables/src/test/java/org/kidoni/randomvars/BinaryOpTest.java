package org.kidoni.randomvars;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.kidoni.randomvars.RandomVars.normal;
import static org.kidoni.randomvars.RandomVars.uniform;

class BinaryOpTest {
    @Test
    void variablesAreDeduplicated() {
        var x = uniform("x");
        var y = normal("y");

        var expr = x.plus(x).times(y).minus(uniform("x"));

        assertEquals(Set.of(x, y), expr.variables());
        assertEquals(Set.of(), Constant.of(1).plus(2).variables());
    }

    @Test
    void partialSubstitution() {
        var x = uniform("x");
        var y = uniform("y");
        var expr = x.plus(y);

        var partial = expr.subs(Map.of(x, Constant.of(1)));

        assertInstanceOf(BinaryOp.class, partial);
        assertEquals(Constant.of(1).plus(y), partial);
        assertEquals(Set.of(y), partial.variables());
        assertEquals(Constant.of(3.0), partial.subs(Map.of(y, Constant.of(2))));
    }

    @Test
    void fullSubstitutionIsIdempotent() {
        var x = uniform("x");
        var y = uniform("y");
        var expr = x.pow(2).plus(y).lt(1);
        var bindings = Map.of(x, Constant.of(0.5), y, Constant.of(0.5));

        var once = expr.subs(bindings);
        var twice = once.subs(bindings);

        assertEquals(Constant.of(true), once);
        assertEquals(once, twice);
    }

    @Test
    void substitutionLeavesTreeUnchanged() {
        var x = uniform("x");
        var expr = x.div(2);

        expr.subs(Map.of(x, Constant.of(1)));

        assertEquals("(x / 2.0)", expr.toString());
        assertEquals(Set.of(x), expr.variables());
    }

    @Test
    void typeMismatchSurfacesOnEvaluation() {
        var x = uniform("x");
        var expr = x.and(true);

        assertInstanceOf(BinaryOp.class, expr);
        assertThrows(TypeMismatchException.class, () -> expr.subs(Map.of(x, Constant.of(0.5))));
    }

    @Test
    void nestedToString() {
        var x = uniform("x");
        var y = uniform("y");

        assertEquals("(((x * y) > 0.25) | (x < 0.1))", x.times(y).gt(0.25).or(x.lt(0.1)).toString());
    }
}
