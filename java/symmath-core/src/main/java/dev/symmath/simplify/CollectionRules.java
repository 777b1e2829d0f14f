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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collection of like terms in sums and like factors in products.
 */
public final class CollectionRules {
    public static final int PRIORITY = 80;

    private CollectionRules() {}

    /**
     * {@code 2*x + 3*x - x} becomes {@code 4*x}. Terms cancelling to zero disappear.
     */
    public static Rule collectLikeTerms() {
        return RewriteRule.of("collect-like-terms", PRIORITY, expression -> {
            if (!isAssociative(expression, AssociativeOp.SUM)) {
                return Optional.empty();
            }
            List<Expression> literals = new ArrayList<>();
            Map<Expression, Double> coefficients = new LinkedHashMap<>();
            boolean repeated = false;
            for (Expression term : ((Associative) expression).getArguments()) {
                if (isSignedLiteral(term)) {
                    literals.add(term);
                    continue;
                }
                Term split = Term.of(term);
                Double previous = coefficients.get(split.base);
                if (previous != null) {
                    repeated = true;
                    coefficients.put(split.base, previous + split.coefficient);
                } else {
                    coefficients.put(split.base, split.coefficient);
                }
            }
            if (!repeated) {
                return Optional.empty();
            }
            List<Expression> terms = new ArrayList<>(literals);
            coefficients.forEach((base, coefficient) -> {
                if (coefficient != 0.0) {
                    terms.add(Term.rebuild(coefficient, base));
                }
            });
            return Optional.of(Expressions.sum(terms));
        });
    }

    /**
     * {@code x * x^2 / x} becomes {@code x^(1 + 2 - 1)}, leaving the exponent sum to the other rules.
     */
    public static Rule collectLikeFactors() {
        return RewriteRule.of("collect-like-factors", PRIORITY, expression -> {
            if (!isAssociative(expression, AssociativeOp.PRODUCT)) {
                return Optional.empty();
            }
            List<Expression> numeric = new ArrayList<>();
            Map<Expression, List<Factor>> factors = new LinkedHashMap<>();
            boolean repeated = false;
            for (Expression factor : ((Associative) expression).getArguments()) {
                if (isNumeric(factor)) {
                    numeric.add(factor);
                    continue;
                }
                Factor split = Factor.of(factor, factor);
                List<Factor> same = factors.computeIfAbsent(split.base, base -> new ArrayList<>());
                repeated |= !same.isEmpty();
                same.add(split);
            }
            if (!repeated) {
                return Optional.empty();
            }
            List<Expression> result = new ArrayList<>(numeric);
            factors.forEach((base, same) -> {
                if (same.size() == 1) {
                    result.add(same.get(0).original);
                } else {
                    List<Expression> exponents = new ArrayList<>(same.size());
                    for (Factor factor : same) {
                        exponents.add(factor.exponent);
                    }
                    result.add(Power.of(base, Expressions.sum(exponents)));
                }
            });
            return Optional.of(Expressions.product(result));
        });
    }

    private static boolean isNumeric(Expression factor) {
        return factor instanceof Constant
                || (isUnary(factor, UnaryOp.INVERT) && argument(factor) instanceof Constant);
    }

    /** A term split into numeric coefficient and symbolic base. */
    private static final class Term {
        private final double coefficient;
        private final Expression base;

        private Term(double coefficient, Expression base) {
            this.coefficient = coefficient;
            this.base = base;
        }

        static Term of(Expression term) {
            if (isUnary(term, UnaryOp.NEGATE)) {
                Term inner = of(argument(term));
                return new Term(-inner.coefficient, inner.base);
            }
            if (isAssociative(term, AssociativeOp.PRODUCT)) {
                double coefficient = 1.0;
                boolean found = false;
                List<Expression> rest = new ArrayList<>();
                for (Expression factor : ((Associative) term).getArguments()) {
                    if (factor instanceof Constant) {
                        coefficient *= factor.value();
                        found = true;
                    } else {
                        rest.add(factor);
                    }
                }
                if (found && !rest.isEmpty()) {
                    return new Term(coefficient, Expressions.product(rest));
                }
            }
            return new Term(1.0, term);
        }

        static Expression rebuild(double coefficient, Expression base) {
            double magnitude = Math.abs(coefficient);
            Expression term = magnitude == 1.0 ? base : Expressions.product(Constant.of(magnitude), base);
            return coefficient < 0 ? Unary.of(UnaryOp.NEGATE, term) : term;
        }
    }

    /** A factor split into base and exponent. */
    private static final class Factor {
        private final Expression original;
        private final Expression base;
        private final Expression exponent;

        private Factor(Expression original, Expression base, Expression exponent) {
            this.original = original;
            this.base = base;
            this.exponent = exponent;
        }

        static Factor of(Expression original, Expression factor) {
            if (factor instanceof Power) {
                Power power = (Power) factor;
                return new Factor(original, power.getBase(), power.getExponent());
            }
            if (isUnary(factor, UnaryOp.INVERT)) {
                Factor inner = of(original, argument(factor));
                return new Factor(original, inner.base, Terms.negate(inner.exponent));
            }
            return new Factor(original, factor, Constant.ONE);
        }
    }
}
