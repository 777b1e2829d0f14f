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
package dev.symmath.api.expressions;

import static dev.symmath.api.Expressions.constant;
import static dev.symmath.api.Expressions.cos;
import static dev.symmath.api.Expressions.product;
import static dev.symmath.api.Expressions.sin;
import static dev.symmath.api.Expressions.variable;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.common.collect.ImmutableMap;
import dev.symmath.api.Expression;
import dev.symmath.simplify.Simplifier;
import org.junit.jupiter.api.Test;

public final class TestDerivatives {
    private static final Variable X = variable("x");
    private static final Variable Y = variable("y");

    private final Simplifier simplifier = new Simplifier();

    private Expression derive(Expression expression, Variable variable) {
        return simplifier.simplify(expression.derivative(variable));
    }

    @Test
    public void testLeaves() {
        assertEquals(constant(0), constant(4).derivative(X));
        assertEquals(constant(1), X.derivative(X));
        assertEquals(constant(0), Y.derivative(X));
        assertEquals(constant(1), X.derivative("x"));
    }

    @Test
    public void testDerivativeDoesNotSimplify() {
        Expression derivative = X.multiply(X).derivative(X);
        assertEquals(X.multiply(constant(1)).add(X.multiply(constant(1))), derivative);
    }

    @Test
    public void testPolynomials() {
        assertEquals(product(constant(2), X), derive(X.multiply(X), X));
        assertEquals(product(constant(2), X), derive(X.pow(constant(2)), X));
        assertEquals(Y, derive(X.multiply(Y), X));
        assertEquals(product(constant(2), X, Y), derive(X.pow(constant(2)).multiply(Y), X));
        assertEquals(product(constant(4), X, Y), derive(X.multiply(X).multiply(Y).multiply(constant(2)), X));
    }

    @Test
    public void testFunctions() {
        Expression fiveX = product(constant(5), X);
        assertEquals(product(constant(5), cos(fiveX)), derive(sin(fiveX), X));
        assertEquals(product(constant(5), sin(fiveX)).negate(), derive(cos(fiveX), X));
        assertEquals(X.cos().pow(constant(2)).invert(), derive(X.tan(), X));
        assertEquals(X.invert(), derive(X.log(), X));
        assertEquals(X.exp(), derive(X.exp(), X));
        assertEquals(constant(2).divide(X), derive(X.pow(constant(2)).log(), X));
        assertEquals(X.pow(constant(2)).invert().negate(), derive(X.invert(), X));
    }

    @Test
    public void testPowers() {
        // ln(2) * 2^x
        Expression exponential = constant(2).pow(X);
        assertEquals(
                Math.log(2) * Math.pow(2, 1.5),
                exponential.derivative(X).evaluate(ImmutableMap.of(X, 1.5)),
                1e-12);
        // x^x * (1 + ln x)
        Expression selfPower = X.pow(X);
        assertEquals(
                Math.pow(1.5, 1.5) * (1 + Math.log(1.5)),
                derive(selfPower, X).evaluate(ImmutableMap.of(X, 1.5)),
                1e-12);
        assertEquals(constant(0), constant(2).pow(constant(3)).derivative(X));
    }

    @Test
    public void testProductOfSinAndCos() {
        Expression derivative = derive(X.sin().multiply(X.cos()), X);
        double x = 0.7;
        double expected = Math.pow(Math.cos(x), 2) - Math.pow(Math.sin(x), 2);
        assertEquals(expected, derivative.evaluate(ImmutableMap.of(X, x)), 1e-9);
    }

    @Test
    public void testLinearity() {
        Expression a = X.pow(constant(3)).multiply(Y);
        Expression b = X.sin().multiply(X);
        assertEquals(
                simplifier.simplify(a.derivative(X).add(b.derivative(X))),
                derive(a.add(b), X));
    }
}
