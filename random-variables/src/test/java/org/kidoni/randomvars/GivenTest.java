package org.kidoni.randomvars;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.kidoni.randomvars.RandomVars.given;
import static org.kidoni.randomvars.RandomVars.uniform;

class GivenTest {
    private final Variable x = uniform("x");
    private final Variable y = uniform("y");

    @Test
    void chainedConditionsAreJoined() {
        var a = x.plus(y);
        var b = x.gt(0.2);
        var c = y.lt(0.8);

        var chained = given(given(a, b), c);

        assertEquals(given(a, b.and(c)), chained);
        assertEquals(a, chained.subject());
        assertEquals(b.and(c), chained.condition());
        assertInstanceOf(BinaryOp.class, chained.subject());
    }

    @Test
    void conditionalConditionIsFlattened() {
        var nested = given(x, given(y.gt(0.5), x.lt(0.5)));

        assertEquals(given(x, y.gt(0.5).and(x.lt(0.5))), nested);
    }

    @Test
    void operatorDistributesOverSubject() {
        var b = x.gt(0.5);

        assertEquals(given(x.plus(1), b), given(x, b).plus(1));
        assertEquals(given(Constant.of(2).times(x), b), Constant.of(2).times(given(x, b)));
        assertEquals(given(y.minus(x), b), y.minus(given(x, b)));
    }

    @Test
    void twoConditionalOperandsJoinConditions() {
        var b = x.gt(0.5);
        var d = y.lt(0.5);

        var combined = given(x, b).times(given(y, d));

        assertEquals(given(x.times(y), b.and(d)), combined);
    }

    @Test
    void variablesCoverSubjectAndCondition() {
        assertEquals(Set.of(x, y), given(x, y.gt(0.5)).variables());
    }

    @Test
    void substitutionStaysConditional() {
        var conditional = given(x, y.gt(0.5));

        var bound = conditional.subs(Map.of(x, Constant.of(0.1), y, Constant.of(0.9)));

        assertEquals(Constant.of(0.1), bound.subject());
        assertEquals(Constant.of(true), bound.condition());
        assertEquals(Set.of(), bound.variables());

        var partial = conditional.subs(Map.of(y, Constant.of(0.9)));
        assertEquals(given(x, Constant.of(true)), partial);
    }

    @Test
    void renders() {
        assertEquals("{ x ; (x > 0.5) }", given(x, x.gt(0.5)).toString());
    }
}
