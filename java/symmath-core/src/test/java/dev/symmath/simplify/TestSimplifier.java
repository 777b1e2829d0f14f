/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.symmath.simplify;

import static dev.symmath.api.Expressions.constant;
import static dev.symmath.api.Expressions.product;
import static dev.symmath.api.Expressions.sum;
import static dev.symmath.api.Expressions.variable;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.symmath.api.Expression;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Variable;
import dev.symmath.parse.Infix;
import java.util.Map;
import org.junit.jupiter.api.Test;

public final class TestSimplifier {
    private static final Variable X = variable("x");
    private static final Variable Y = variable("y");
    private static final Expression ONE = constant(1);
    private static final Expression TWO = constant(2);

    private static final ImmutableList<Expression> CORPUS = ImmutableList.of(
            X.add(ONE.add(X)),
            ONE.add(ONE.add(X.add(ONE).add(ONE)).add(ONE)),
            X.pow(TWO).multiply(Y.pow(X.subtract(ONE))).divide(X.pow(constant(3))).divide(Y.pow(constant(-1))),
            X.sin().multiply(X.cos()).derivative(X),
            X.add(Y).multiply(X.subtract(Y)),
            X.divide(constant(5)).add(ONE).add(ONE),
            X.add(Y).negate().subtract(constant(3)),
            X.log().add(ONE).exp().multiply(TWO).divide(constant(4)),
            Y.pow(TWO).multiply(Y).divide(Y.pow(constant(3))).add(X),
            X.add(X).multiply(constant(-3)),
            ONE.divide(X.multiply(Y)).multiply(X),
            X.tan().divide(X).subtract(X.tan().divide(X)),
            X.pow(constant(3)).multiply(Y).derivative(X).derivative(X),
            X.multiply(Y).exp().log().add(Y.multiply(X).negate()),
            constant(7).subtract(constant(5).multiply(X)).add(constant(5).multiply(X)),
            X.divide(TWO).multiply(TWO),
            X.sin().divide(X.cos()).add(X.sin().divide(X.cos())).multiply(constant(0.5)));

    private final Simplifier simplifier = new Simplifier();

    private Expression simplify(Expression expression) {
        return simplifier.simplify(expression);
    }

    @Test
    public void testScenarios() {
        Expression first = simplify(X.add(ONE.add(X)));
        assertEquals(sum(ONE, product(TWO, X)), first);
        assertEquals("(1 + (2 * x))", first.toString());

        Expression second = simplify(ONE.add(ONE.add(X.add(ONE).add(ONE)).add(ONE)));
        assertEquals(sum(constant(5), X), second);
        assertEquals("(5 + x)", second.toString());

        Expression fourth = simplify(
                X.pow(TWO).multiply(Y.pow(X.subtract(ONE))).divide(X.pow(constant(3))).divide(Y.pow(constant(-1))));
        assertEquals(Y.pow(X).divide(X), fourth);
        assertEquals("((y ^ x) / x)", fourth.toString());

        assertEquals(Constant.ZERO, simplify(X.add(X).subtract(X.add(X))));
    }

    @Test
    public void testIdentities() {
        assertEquals(X, simplify(X.add(constant(0))));
        assertEquals(X, simplify(X.multiply(ONE)));
        assertEquals(Constant.ZERO, simplify(X.multiply(constant(0))));
        assertEquals(ONE, simplify(X.divide(X)));
        assertEquals(X, simplify(X.exp().log()));
        assertEquals(X, simplify(X.log().exp()));
        assertEquals(X, simplify(X.negate().negate()));
        assertEquals(X, simplify(X.pow(ONE)));
        assertEquals(ONE, simplify(X.pow(constant(0))));
        assertEquals(sum(ONE, X), simplify(X.add(ONE).exp().log()));
    }

    @Test
    public void testExactness() {
        assertEquals(ONE, simplify(ONE.divide(constant(3)).multiply(constant(3))));
        Expression third = simplify(Infix.parse("1/3"));
        assertEquals(constant(3).invert(), third);
        assertEquals("(1 / 3)", third.toString());
        assertEquals("(1 / 2)", simplify(TWO.divide(constant(4))).toString());
        assertEquals("(2 / 3)", simplify(constant(4).divide(constant(6))).toString());
        assertEquals(constant(3), simplify(constant(6).divide(TWO)));
        assertEquals(constant(1024), simplify(TWO.pow(constant(10))));
        assertEquals(
                constant(2e19).multiply(constant(3e19).invert()),
                simplify(constant(2e19).divide(constant(3e19))));
    }

    @Test
    public void testConstantFolding() {
        assertEquals("(2 + (x / 5))", simplify(X.divide(constant(5)).add(ONE).add(ONE)).toString());
        assertEquals("(2 / 5)", simplify(ONE.add(ONE).divide(constant(5))).toString());
        assertEquals("(x - 5)", simplify(X.subtract(ONE.add(TWO).add(TWO))).toString());
        assertEquals("(5 - x)", simplify(ONE.add(TWO).add(TWO).subtract(X)).toString());
        assertEquals(
                "(-x)",
                simplify(ONE.log().add(ONE).add(TWO).add(TWO).multiply(ONE.log()).subtract(X)).toString());
        assertEquals(product(TWO, X), simplify(X.multiply(TWO.divide(ONE))));
        assertEquals(X, simplify(X.divide(TWO).multiply(TWO)));
        assertEquals(constant(2).negate(), simplify(constant(-2)));
    }

    @Test
    public void testLikeTerms() {
        Expression z = X.sin();
        assertEquals(product(constant(4), X), simplify(X.add(X).add(X).add(X)));
        assertEquals(product(constant(6), z), simplify(z.add(z).multiply(constant(3))));
        assertEquals(
                product(constant(6), z), simplify(z.add(z).multiply(constant(4)).subtract(z).subtract(z)));
        assertEquals(product(constant(6), z).negate(), simplify(z.add(z).multiply(constant(-3))));
        assertEquals(
                z.add(product(TWO, X.log()).negate()), simplify(z.subtract(X.log()).subtract(X.log())));
        assertEquals(TWO, simplify(constant(5).multiply(X).subtract(constant(5).multiply(X)).add(TWO)));
        assertEquals(constant(7), simplify(constant(7).subtract(constant(5).multiply(X)).add(constant(5).multiply(X))));
        assertEquals(
                sum(constant(4), product(constant(3), X), product(constant(14), Y)),
                simplify(constant(5)
                        .multiply(Y)
                        .add(constant(4))
                        .add(constant(3).multiply(X))
                        .add(constant(5).multiply(Y))
                        .add(constant(4).multiply(Y))));
    }

    @Test
    public void testLikeFactors() {
        assertEquals(X.pow(constant(3)), simplify(X.pow(TWO).multiply(X)));
        assertEquals(X, simplify(Y.pow(TWO).multiply(Y).divide(Y.pow(constant(3))).multiply(X)));
        assertEquals(Y.invert(), simplify(ONE.divide(X.multiply(Y)).multiply(X)));
        assertEquals(X.pow(TWO).invert(), simplify(X.invert().multiply(X.invert())));
    }

    @Test
    public void testCommutativity() {
        for (Expression a : CORPUS) {
            for (Expression b : ImmutableList.of(X, Y.sin(), X.multiply(Y), constant(3))) {
                assertEquals(simplify(a.add(b)), simplify(b.add(a)));
                assertEquals(simplify(a.multiply(b)), simplify(b.multiply(a)));
            }
        }
    }

    @Test
    public void testIdempotence() {
        for (Expression expression : CORPUS) {
            Expression once = simplify(expression);
            assertEquals(once, simplify(once), () -> "not idempotent on " + expression);
        }
    }

    @Test
    public void testEquivalence() {
        for (Map<Variable, Double> bindings : ImmutableList.of(
                ImmutableMap.of(X, 0.7, Y, 1.3), ImmutableMap.of(X, 2.5, Y, 0.2), ImmutableMap.of(X, 1.1, Y, 3.0))) {
            for (Expression expression : CORPUS) {
                double expected = expression.evaluate(bindings);
                double actual = simplify(expression).evaluate(bindings);
                assertEquals(expected, actual, 1e-9 * Math.max(1.0, Math.abs(expected)), expression::toString);
            }
        }
    }

    @Test
    public void testNeverMoreComplex() {
        for (Expression expression : CORPUS) {
            assertTrue(simplify(expression).complexity() <= expression.complexity(), expression::toString);
        }
    }

    @Test
    public void testSimplifiedConstantsStayExact() {
        Expression result = simplify(ONE.divide(constant(3)).add(ONE.divide(constant(3))));
        assertFalse(result.toString().contains("0.66"), result::toString);
        assertEquals(2.0 / 3.0, result.value(), 1e-15);
    }
}
