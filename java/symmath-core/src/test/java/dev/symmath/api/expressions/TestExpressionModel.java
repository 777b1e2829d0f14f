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
import static dev.symmath.api.Expressions.product;
import static dev.symmath.api.Expressions.sum;
import static dev.symmath.api.Expressions.variable;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import dev.symmath.api.Expression;
import dev.symmath.api.expressions.Associative.AssociativeOp;
import org.junit.jupiter.api.Test;

public final class TestExpressionModel {
    private static final Variable X = variable("x");
    private static final Variable Y = variable("y");

    @Test
    public void testAttributes() {
        Expression expression = X.add(constant(1));
        assertFalse(expression.isConstant());
        assertEquals(2, expression.height());
        assertEquals(3, expression.size());
        assertEquals(2, expression.complexity());

        // a constant product is cheaper than a symbolic one of the same shape
        assertEquals(2, constant(3).multiply(constant(1).divide(constant(3))).complexity());
        assertEquals(4, X.multiply(constant(1).divide(X)).complexity());
    }

    @Test
    public void testConstantness() {
        assertTrue(constant(2).sin().add(constant(3).pow(constant(2))).isConstant());
        assertFalse(constant(2).multiply(X).isConstant());
        assertEquals(9.0, constant(3).pow(constant(2)).value());
    }

    @Test
    public void testValueOfNonConstant() {
        assertThrows(IllegalStateException.class, () -> X.add(constant(1)).value());
    }

    @Test
    public void testInvalidVariableName() {
        assertThrows(IllegalArgumentException.class, () -> Variable.of(""));
        assertThrows(IllegalArgumentException.class, () -> Variable.of(null));
    }

    @Test
    public void testAssociativeArity() {
        assertThrows(IllegalArgumentException.class, () -> Associative.of(AssociativeOp.SUM, ImmutableList.of(X)));
        assertThrows(NullPointerException.class, () -> X.add(null));
        assertEquals(constant(0), sum());
        assertEquals(constant(1), product());
        assertSame(X, sum(X));
    }

    @Test
    public void testCombinatorsFlatten() {
        Expression expression = X.add(Y).add(X.add(constant(1)));
        assertEquals(4, ((Associative) expression).getArgumentCount());

        Expression difference = X.subtract(Y);
        assertEquals(Associative.of(AssociativeOp.SUM, X, Y.negate()), difference);

        assertEquals(Y.invert(), constant(1).divide(Y));
        assertEquals(Associative.of(AssociativeOp.PRODUCT, X, Y.invert()), X.divide(Y));
    }

    @Test
    public void testEqualityIgnoresArgumentOrder() {
        assertEquals(X.add(Y), Y.add(X));
        assertEquals(X.add(Y).hashCode(), Y.add(X).hashCode());
        assertEquals(X.multiply(Y).multiply(X), X.multiply(X).multiply(Y));
        assertNotEquals(X.multiply(Y).multiply(X), X.multiply(Y).multiply(Y));
        assertNotEquals(X.add(Y), X.multiply(Y));
        assertNotEquals(X.pow(Y), Y.pow(X));
        assertNotEquals(X.sin(), X.cos());
    }

    @Test
    public void testConstantEquality() {
        assertEquals(constant(0.0), constant(-0.0));
        assertEquals(constant(Double.NaN), constant(Double.NaN));
        assertEquals(constant(2.5), constant(2.5));
        assertNotEquals(constant(2), X);
    }

    @Test
    public void testToString() {
        assertEquals("5", constant(5).toString());
        assertEquals("2.5", constant(2.5).toString());
        assertEquals("(-2)", constant(-2).toString());
        assertEquals("(-0.5)", constant(-0.5).toString());
        assertEquals("((-2) ^ x)", constant(-2).pow(X).toString());
        assertEquals("(x + 1)", X.add(constant(1)).toString());
        assertEquals("(x - y)", X.subtract(Y).toString());
        assertEquals("(x / y)", X.divide(Y).toString());
        assertEquals("(1 / y)", constant(1).divide(Y).toString());
        assertEquals("(1 / y * x)", Y.invert().multiply(X).toString());
        assertEquals("(-x)", X.negate().toString());
        assertEquals("(x ^ 2)", X.pow(constant(2)).toString());
        assertEquals("ln(sin(x))", X.sin().log().toString());
        assertEquals("exp(tan(cos(x)))", X.cos().tan().exp().toString());
    }

    @Test
    public void testVisitor() {
        Expression.Visitor<String> kind = new Expression.Visitor<String>() {
            @Override
            public String visitConstant(Constant constant) {
                return "constant";
            }

            @Override
            public String visitVariable(Variable variable) {
                return "variable";
            }

            @Override
            public String visitUnary(Unary unary) {
                return "unary " + unary.getOperator().name();
            }

            @Override
            public String visitAssociative(Associative associative) {
                return "associative " + associative.getOperator().name();
            }

            @Override
            public String visitPower(Power power) {
                return "power";
            }
        };
        assertEquals("constant", constant(1).accept(kind));
        assertEquals("variable", X.accept(kind));
        assertEquals("unary EXP", X.exp().accept(kind));
        assertEquals("associative PRODUCT", X.multiply(Y).accept(kind));
        assertEquals("power", X.pow(Y).accept(kind));
    }
}
