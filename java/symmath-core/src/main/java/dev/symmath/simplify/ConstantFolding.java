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

import static dev.symmath.simplify.Terms.argument;
import static dev.symmath.simplify.Terms.isAssociative;
import static dev.symmath.simplify.Terms.isInteger;
import static dev.symmath.simplify.Terms.isSignedLiteral;
import static dev.symmath.simplify.Terms.isUnary;

import dev.symmath.api.Expression;
import dev.symmath.api.Expressions;
import dev.symmath.api.expressions.Associative;
import dev.symmath.api.expressions.Associative.AssociativeOp;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Power;
import dev.symmath.api.expressions.Unary;
import dev.symmath.api.expressions.Unary.UnaryOp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exact arithmetic on literal arguments.
 * <p>
 * A quotient is only computed when it is exact. {@code 2 / 4} becomes {@code 1 / 2} and {@code 4 / 6}
 * becomes {@code 2 / 3}, but {@code 1 / 3} is never turned into a decimal.
 */
public final class ConstantFolding {
    public static final int PRIORITY = 90;

    /** Largest magnitude up to which every integer is exactly representable as a double. */
    private static final double MAX_EXACT_INTEGER = 9007199254740992.0;

    private ConstantFolding() {}

    /**
     * Adds up the literal terms of a sum. A literal zero is dropped.
     */
    public static Rule foldSum() {
        return RewriteRule.of("fold-sum-literals", PRIORITY, expression -> {
            if (!isAssociative(expression, AssociativeOp.SUM)) {
                return Optional.empty();
            }
            int literals = 0;
            double total = 0.0;
            List<Expression> others = new ArrayList<>();
            for (Expression term : ((Associative) expression).getArguments()) {
                if (isSignedLiteral(term)) {
                    literals++;
                    total += Terms.signedValue(term);
                } else {
                    others.add(term);
                }
            }
            if (literals == 0 || (literals == 1 && total != 0.0)) {
                return Optional.empty();
            }
            List<Expression> terms = new ArrayList<>(others.size() + 1);
            if (total != 0.0) {
                terms.add(Terms.literal(total));
            }
            terms.addAll(others);
            return Optional.of(Expressions.sum(terms));
        });
    }

    /**
     * Multiplies the literal factors and the inverted literal factors of a product, then reduces the
     * resulting fraction as far as it stays exact. A literal zero makes the whole product zero.
     */
    public static Rule foldProduct() {
        return RewriteRule.of("fold-product-literals", PRIORITY, expression -> {
            if (!isAssociative(expression, AssociativeOp.PRODUCT)) {
                return Optional.empty();
            }
            List<Double> numerators = new ArrayList<>();
            List<Double> denominators = new ArrayList<>();
            List<Expression> others = new ArrayList<>();
            for (Expression factor : ((Associative) expression).getArguments()) {
                if (factor instanceof Constant) {
                    numerators.add(factor.value());
                } else if (isUnary(factor, UnaryOp.INVERT) && argument(factor) instanceof Constant) {
                    denominators.add(argument(factor).value());
                } else {
                    others.add(factor);
                }
            }
            if (numerators.contains(0.0)) {
                return Optional.of(Constant.ZERO);
            }
            if (numerators.isEmpty() && denominators.isEmpty()) {
                return Optional.empty();
            }
            double n = multiply(numerators);
            double d = multiply(denominators);
            if (!numerators.isEmpty() && !denominators.isEmpty() && d != 0.0) {
                if (n % d == 0.0) {
                    n = n / d;
                    d = 1.0;
                } else if (d % n == 0.0) {
                    d = d / n;
                    n = 1.0;
                } else if (isInteger(n) && isInteger(d)
                        && Math.abs(n) <= MAX_EXACT_INTEGER && Math.abs(d) <= MAX_EXACT_INTEGER) {
                    long gcd = Terms.gcd((long) n, (long) d);
                    if (gcd > 1) {
                        n = n / gcd;
                        d = d / gcd;
                    }
                }
            }
            boolean unchanged = numerators.size() == (n != 1.0 ? 1 : 0)
                    && denominators.size() == (d != 1.0 ? 1 : 0)
                    && (numerators.isEmpty() || Double.compare(numerators.get(0), n) == 0)
                    && (denominators.isEmpty() || Double.compare(denominators.get(0), d) == 0);
            if (unchanged) {
                return Optional.empty();
            }
            List<Expression> factors = new ArrayList<>(others.size() + 2);
            if (n != 1.0) {
                factors.add(Constant.of(n));
            }
            if (d != 1.0) {
                factors.add(Unary.of(UnaryOp.INVERT, Constant.of(d)));
            }
            factors.addAll(others);
            return Optional.of(Expressions.product(factors));
        });
    }

    /**
     * {@code 1 / c} for a literal {@code c} that divides one exactly, such as {@code 1 / 0.25 = 4}.
     */
    public static Rule foldInverse() {
        return RewriteRule.of("fold-inverse-literal", PRIORITY, expression -> {
            if (isUnary(expression, UnaryOp.INVERT) && argument(expression) instanceof Constant) {
                double value = argument(expression).value();
                if (value != 0.0 && 1.0 % value == 0.0) {
                    return Optional.of(Constant.of(1.0 / value));
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Integer powers of integer literals, as long as the result is an exact integer.
     */
    public static Rule foldPower() {
        return RewriteRule.of("fold-power-literals", PRIORITY, expression -> {
            if (!(expression instanceof Power)) {
                return Optional.empty();
            }
            Power power = (Power) expression;
            if (!isSignedLiteral(power.getBase()) || !(power.getExponent() instanceof Constant)) {
                return Optional.empty();
            }
            double base = Terms.signedValue(power.getBase());
            double exponent = power.getExponent().value();
            if (!isInteger(base) || !isInteger(exponent) || exponent < 0) {
                return Optional.empty();
            }
            double result = Math.pow(base, exponent);
            if (Math.abs(result) > MAX_EXACT_INTEGER) {
                return Optional.empty();
            }
            return Optional.of(Terms.literal(result));
        });
    }

    private static double multiply(List<Double> values) {
        double result = 1.0;
        for (double value : values) {
            result *= value;
        }
        return result;
    }
}
