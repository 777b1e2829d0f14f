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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.symmath.api.Expression;
import dev.symmath.api.Expressions;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Unary;
import dev.symmath.api.expressions.Variable;
import dev.symmath.simplify.Simplifier;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Taylor polynomial of an expression around a point.
 * <p>
 * Coefficients stay exact where possible: a derivative that simplifies to an integer at the expansion point
 * gives the coefficient {@code f(i)(a) / i!} as a reduced fraction rather than a decimal. Derivatives that
 * still depend on other variables keep a symbolic coefficient.
 */
public final class TaylorSeries {
    private static final Logger log = LoggerFactory.getLogger(TaylorSeries.class);

    /** Beyond 20! factorials are no longer exact doubles. */
    public static final int MAX_TERMS = 20;

    private final Simplifier simplifier;

    public TaylorSeries() {
        this(new Simplifier());
    }

    public TaylorSeries(Simplifier simplifier) {
        this.simplifier = checkNotNull(simplifier, "simplifier");
    }

    /**
     * The coefficients {@code c0 .. c(terms-1)} of the expansion of {@code function} in {@code variable}
     * around {@code point}.
     */
    public ImmutableList<Expression> coefficients(Expression function, Variable variable, double point, int terms) {
        checkNotNull(function, "function");
        checkNotNull(variable, "variable");
        checkArgument(terms >= 1 && terms <= MAX_TERMS, "terms must be between 1 and %s: %s", MAX_TERMS, terms);

        ImmutableMap<Variable, Expression> at = ImmutableMap.of(variable, Expressions.constant(point));
        ImmutableList.Builder<Expression> coefficients = ImmutableList.builder();
        Expression derivative = simplifier.simplify(function);
        double factorial = 1.0;
        for (int i = 0; i < terms; i++) {
            if (i > 0) {
                factorial *= i;
                derivative = simplifier.simplify(derivative.derivative(variable));
            }
            Expression value = simplifier.simplify(derivative.with(at));
            Expression coefficient;
            if (isIntegerLiteral(value) || !value.isConstant()) {
                coefficient = simplifier.simplify(value.divide(Constant.of(factorial)));
            } else {
                coefficient = Constant.of(value.evaluate() / factorial);
            }
            log.debug("Term {}: derivative {} gives coefficient {}", i, derivative, coefficient);
            coefficients.add(coefficient);
        }
        return coefficients.build();
    }

    /**
     * The simplified polynomial {@code sum of c(i) * (variable - point)^i} for {@code i < terms}.
     *
     * @throws IllegalArgumentException if {@code terms} is not between 1 and {@link #MAX_TERMS}
     */
    public Expression expand(Expression function, Variable variable, double point, int terms) {
        List<Expression> coefficients = coefficients(function, variable, point, terms);
        Expression offset = point == 0.0 ? variable : variable.subtract(Expressions.constant(point));
        List<Expression> series = new ArrayList<>(terms);
        for (int i = 0; i < coefficients.size(); i++) {
            Expression power = i == 0 ? Constant.ONE : offset.pow(Expressions.constant(i));
            series.add(coefficients.get(i).multiply(power));
        }
        Expression result = simplifier.simplify(Expressions.sum(series));
        log.info("Expanded {} around {} = {} to {} terms", function, variable, point, terms);
        return result;
    }

    private static boolean isIntegerLiteral(Expression expression) {
        if (expression instanceof Unary && ((Unary) expression).is(Unary.UnaryOp.NEGATE)) {
            expression = ((Unary) expression).getArgument();
        }
        return expression instanceof Constant && ((Constant) expression).isInteger();
    }
}
