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

import dev.symmath.api.Expression;
import dev.symmath.api.expressions.Associative;
import dev.symmath.api.expressions.Associative.AssociativeOp;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Unary;
import dev.symmath.api.expressions.Unary.UnaryOp;

/**
 * Small structural helpers shared by the rule library.
 */
final class Terms {
    private Terms() {}

    static boolean isUnary(Expression expression, UnaryOp op) {
        return expression instanceof Unary && ((Unary) expression).is(op);
    }

    static boolean isAssociative(Expression expression, AssociativeOp op) {
        return expression instanceof Associative && ((Associative) expression).is(op);
    }

    static Expression argument(Expression unary) {
        return ((Unary) unary).getArgument();
    }

    /**
     * A literal number inside a sum: a constant or a negated constant.
     */
    static boolean isSignedLiteral(Expression expression) {
        return expression instanceof Constant
                || (isUnary(expression, UnaryOp.NEGATE) && argument(expression) instanceof Constant);
    }

    static double signedValue(Expression literal) {
        if (literal instanceof Constant) {
            return literal.value();
        }
        return -argument(literal).value();
    }

    /**
     * Canonical literal for a value: negative numbers become a negated positive constant.
     */
    static Expression literal(double value) {
        if (value < 0) {
            return Unary.of(UnaryOp.NEGATE, Constant.of(-value));
        }
        return Constant.of(value);
    }

    static Expression negate(Expression expression) {
        if (isUnary(expression, UnaryOp.NEGATE)) {
            return argument(expression);
        }
        if (expression instanceof Constant) {
            return literal(-expression.value());
        }
        return Unary.of(UnaryOp.NEGATE, expression);
    }

    static Expression invert(Expression expression) {
        if (isUnary(expression, UnaryOp.INVERT)) {
            return argument(expression);
        }
        return Unary.of(UnaryOp.INVERT, expression);
    }

    static boolean isInteger(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
