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

import dev.symmath.api.Expression;
import java.util.Map;

/**
 * A numeric literal.
 */
public final class Constant extends BaseExpression {
    public static final Constant ZERO = new Constant(0.0);
    public static final Constant ONE = new Constant(1.0);

    // integral values beyond this print in exponent form
    private static final double MAX_PLAIN_INTEGER = 1e15;

    private final double value;

    private Constant(double value) {
        super(true, 1, 1, 0, Double.hashCode(value));
        this.value = value;
    }

    public static Constant of(double value) {
        // -0.0 and 0.0 are the same literal
        if (value == 0.0) {
            return ZERO;
        }
        if (value == 1.0) {
            return ONE;
        }
        return new Constant(value);
    }

    /**
     * True if {@code expression} is the literal {@code value}.
     */
    public static boolean isLiteral(Expression expression, double value) {
        return expression instanceof Constant && ((Constant) expression).value == value;
    }

    public boolean isInteger() {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    @Override
    public String type() {
        return "constant";
    }

    @Override
    public double value() {
        return value;
    }

    @Override
    public double evaluate(Map<Variable, Double> bindings) {
        return value;
    }

    @Override
    public Expression with(Map<Variable, Expression> bindings) {
        return this;
    }

    @Override
    public Expression derivative(Variable variable) {
        return ZERO;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Constant)) return false;
        Constant other = (Constant) o;
        return value == other.value || (Double.isNaN(value) && Double.isNaN(other.value));
    }

    @Override
    public String toString() {
        // Parenthesized like a negation, so the sign never binds to a neighbouring operator.
        return value < 0 ? "(-" + format(-value) + ")" : format(value);
    }

    private static String format(double value) {
        if (value == Math.rint(value) && value < MAX_PLAIN_INTEGER) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
