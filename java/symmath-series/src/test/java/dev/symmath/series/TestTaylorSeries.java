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
package dev.symmath.series;

import static dev.symmath.api.Expressions.constant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.symmath.api.Expression;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Variable;
import dev.symmath.parse.Infix;
import org.junit.jupiter.api.Test;

public final class TestTaylorSeries {
    private static final Variable X = Variable.of("x");
    private static final Expression ONE = constant(1);

    private final TaylorSeries series = new TaylorSeries();

    @Test
    public void testExponentialCoefficientsAreExact() {
        assertEquals(
                ImmutableList.of(
                        ONE,
                        ONE,
                        ONE.divide(constant(2)),
                        ONE.divide(constant(6)),
                        ONE.divide(constant(24))),
                series.coefficients(X.exp(), X, 0.0, 5));
    }

    @Test
    public void testSineCoefficients() {
        assertEquals(
                ImmutableList.of(
                        Constant.ZERO,
                        ONE,
                        Constant.ZERO,
                        ONE.divide(constant(6)).negate(),
                        Constant.ZERO,
                        ONE.divide(constant(120))),
                series.coefficients(X.sin(), X, 0.0, 6));
    }

    @Test
    public void testExpansionApproximatesFunction() {
        Expression expansion = series.expand(Infix.parse("sin(x)*cos(x)"), X, 0.0, 10);
        double x = 0.3;
        assertEquals(Math.sin(x) * Math.cos(x), expansion.evaluate(ImmutableMap.of(X, x)), 1e-9);
        assertFalse(expansion.toString().contains("0.1666"), expansion::toString);
    }

    @Test
    public void testExpansionAroundOtherPoint() {
        Expression expansion = series.expand(X.pow(constant(2)), X, 1.0, 3);
        assertEquals(9.0, expansion.evaluate(ImmutableMap.of(X, 3.0)), 1e-12);
    }

    @Test
    public void testNonIntegralDerivativesFallBackToDecimals() {
        ImmutableList<Expression> coefficients = series.coefficients(X.sin(), X, 0.5, 2);
        assertEquals(Math.sin(0.5), coefficients.get(0).value(), 1e-15);
        assertEquals(Math.cos(0.5), coefficients.get(1).value(), 1e-15);
    }

    @Test
    public void testTermLimits() {
        assertThrows(IllegalArgumentException.class, () -> series.expand(X.exp(), X, 0.0, 0));
        assertThrows(IllegalArgumentException.class, () -> series.expand(X.exp(), X, 0.0, TaylorSeries.MAX_TERMS + 1));
    }
}
