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
import static dev.symmath.simplify.Terms.isUnary;

import com.google.common.collect.ImmutableList;
import dev.symmath.api.Expression;
import dev.symmath.api.Expressions;
import dev.symmath.api.expressions.Associative;
import dev.symmath.api.expressions.Associative.AssociativeOp;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Unary;
import dev.symmath.api.expressions.Unary.UnaryOp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rules that change the shape of a tree without doing arithmetic: argument ordering, flattening of nested
 * sums and products, and the placement of negations.
 */
public final class StructuralRules {
    public static final int SORT_PRIORITY = 100;
    public static final int FLATTEN_PRIORITY = 98;
    public static final int NEGATION_PRIORITY = 95;
    public static final int PRESENTATION_PRIORITY = 10;

    private StructuralRules() {}

    /**
     * Sorts the arguments of sums and products by {@link CanonicalOrder}.
     */
    public static Rule sortArguments() {
        return RewriteRule.of("sort-arguments", SORT_PRIORITY, expression -> {
            if (!(expression instanceof Associative)) {
                return Optional.empty();
            }
            Associative associative = (Associative) expression;
            if (CanonicalOrder.INSTANCE.isSorted(associative.getArguments())) {
                return Optional.empty();
            }
            return Optional.of(associative.withArguments(
                    ImmutableList.sortedCopyOf(CanonicalOrder.INSTANCE, associative.getArguments())));
        });
    }

    /**
     * {@code a + (b + c)} becomes {@code a + b + c} and {@code a - (b + c)} becomes {@code a - b - c}.
     * Products are treated the same way with inversion in place of negation.
     */
    public static Rule flatten() {
        return RewriteRule.of("flatten", FLATTEN_PRIORITY, expression -> {
            if (!(expression instanceof Associative)) {
                return Optional.empty();
            }
            Associative associative = (Associative) expression;
            AssociativeOp op = associative.getOperator();
            UnaryOp inverse = op.inverse();
            boolean nested = false;
            List<Expression> arguments = new ArrayList<>();
            for (Expression argument : associative.getArguments()) {
                if (isAssociative(argument, op)) {
                    nested = true;
                    arguments.addAll(((Associative) argument).getArguments());
                } else if (isUnary(argument, inverse) && isAssociative(argument(argument), op)) {
                    nested = true;
                    for (Expression inner : ((Associative) argument(argument)).getArguments()) {
                        arguments.add(op == AssociativeOp.SUM ? Terms.negate(inner) : Terms.invert(inner));
                    }
                } else {
                    arguments.add(argument);
                }
            }
            if (!nested) {
                return Optional.empty();
            }
            return Optional.of(op == AssociativeOp.SUM ? Expressions.sum(arguments) : Expressions.product(arguments));
        });
    }

    /**
     * Moves negated factors out of a product: {@code a * (-b) * (-c)} becomes {@code a * b * c}.
     */
    public static Rule pullNegationOutOfProduct() {
        return RewriteRule.of("pull-negation", NEGATION_PRIORITY, expression -> {
            if (!isAssociative(expression, AssociativeOp.PRODUCT)) {
                return Optional.empty();
            }
            int negations = 0;
            List<Expression> factors = new ArrayList<>();
            for (Expression factor : ((Associative) expression).getArguments()) {
                if (isUnary(factor, UnaryOp.NEGATE)) {
                    negations++;
                    factors.add(argument(factor));
                } else {
                    factors.add(factor);
                }
            }
            if (negations == 0) {
                return Optional.empty();
            }
            Expression product = Expressions.product(factors);
            return Optional.of(negations % 2 == 0 ? product : Unary.of(UnaryOp.NEGATE, product));
        });
    }

    /**
     * {@code 1 / (-x)} becomes {@code -(1 / x)}.
     */
    public static Rule pullNegationOutOfInverse() {
        return RewriteRule.of("invert-negation", NEGATION_PRIORITY, expression -> {
            if (isUnary(expression, UnaryOp.INVERT) && isUnary(argument(expression), UnaryOp.NEGATE)) {
                Expression inner = argument(argument(expression));
                return Optional.of(Unary.of(UnaryOp.NEGATE, Unary.of(UnaryOp.INVERT, inner)));
            }
            return Optional.empty();
        });
    }

    /**
     * A negative constant becomes the negation of a positive one so that signs are always explicit nodes.
     */
    public static Rule extractNegativeLiteral() {
        return RewriteRule.of("negative-literal", NEGATION_PRIORITY, expression -> {
            if (expression instanceof Constant && expression.value() < 0) {
                return Optional.of(Terms.literal(expression.value()));
            }
            return Optional.empty();
        });
    }

    /**
     * Rotates a sum that starts with a negated term so that it starts with its first positive term, which
     * renders as {@code x - 5} instead of {@code -5 + x}.
     */
    public static Rule leadWithPositiveTerm() {
        return rotate("lead-with-positive-term", AssociativeOp.SUM);
    }

    /**
     * Rotates a product that starts with an inverted factor so that it renders as {@code x / 5}.
     */
    public static Rule leadWithNumerator() {
        return rotate("lead-with-numerator", AssociativeOp.PRODUCT);
    }

    private static Rule rotate(String name, AssociativeOp op) {
        return RewriteRule.of(name, PRESENTATION_PRIORITY, expression -> {
            if (!isAssociative(expression, op)) {
                return Optional.empty();
            }
            ImmutableList<Expression> arguments = ((Associative) expression).getArguments();
            if (!isUnary(arguments.get(0), op.inverse())) {
                return Optional.empty();
            }
            for (int i = 1; i < arguments.size(); i++) {
                if (!isUnary(arguments.get(i), op.inverse())) {
                    Expression lead = arguments.get(i);
                    List<Expression> rotated = new ArrayList<>(arguments.size());
                    rotated.add(lead);
                    rotated.addAll(arguments.subList(0, i));
                    rotated.addAll(arguments.subList(i + 1, arguments.size()));
                    return Optional.of(((Associative) expression).withArguments(rotated));
                }
            }
            return Optional.empty();
        });
    }
}
