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
import static dev.symmath.simplify.Terms.isUnary;

import dev.symmath.api.Expression;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Power;
import dev.symmath.api.expressions.Unary;
import dev.symmath.api.expressions.Unary.UnaryOp;
import java.util.Optional;

/**
 * Algebraic identities of the unary functions and of powers.
 */
public final class IdentityRules {
    public static final int PRIORITY = 90;
    public static final int NEGATIVE_EXPONENT_PRIORITY = 85;

    private IdentityRules() {}

    public static Rule doubleNegation() {
        return cancel("double-negation", UnaryOp.NEGATE, UnaryOp.NEGATE);
    }

    public static Rule doubleInversion() {
        return cancel("double-inversion", UnaryOp.INVERT, UnaryOp.INVERT);
    }

    public static Rule logOfExp() {
        return cancel("log-of-exp", UnaryOp.LOG, UnaryOp.EXP);
    }

    public static Rule expOfLog() {
        return cancel("exp-of-log", UnaryOp.EXP, UnaryOp.LOG);
    }

    /** {@code outer(inner(x))} is {@code x}. */
    private static Rule cancel(String name, UnaryOp outer, UnaryOp inner) {
        return RewriteRule.of(name, PRIORITY, expression -> {
            if (isUnary(expression, outer) && isUnary(argument(expression), inner)) {
                return Optional.of(argument(argument(expression)));
            }
            return Optional.empty();
        });
    }

    /**
     * Known values at the neutral points: {@code -0}, {@code ln 1}, {@code exp 0}, {@code sin 0},
     * {@code cos 0} and {@code tan 0}.
     */
    public static Rule elementaryValues() {
        return RewriteRule.of("elementary-values", PRIORITY, expression -> {
            if (!(expression instanceof Unary)) {
                return Optional.empty();
            }
            Unary unary = (Unary) expression;
            Expression argument = unary.getArgument();
            switch (unary.getOperator()) {
                case NEGATE:
                case SIN:
                case TAN:
                    return Constant.isLiteral(argument, 0.0) ? Optional.of(Constant.ZERO) : Optional.empty();
                case EXP:
                case COS:
                    return Constant.isLiteral(argument, 0.0) ? Optional.of(Constant.ONE) : Optional.empty();
                case LOG:
                    return Constant.isLiteral(argument, 1.0) ? Optional.of(Constant.ZERO) : Optional.empty();
                default:
                    return Optional.empty();
            }
        });
    }

    /**
     * {@code x^1 = x}, {@code x^0 = 1} and {@code 1^x = 1}.
     */
    public static Rule powerIdentities() {
        return RewriteRule.of("power-identities", PRIORITY, expression -> {
            if (!(expression instanceof Power)) {
                return Optional.empty();
            }
            Power power = (Power) expression;
            if (Constant.isLiteral(power.getExponent(), 1.0)) {
                return Optional.of(power.getBase());
            }
            if (Constant.isLiteral(power.getExponent(), 0.0) || Constant.isLiteral(power.getBase(), 1.0)) {
                return Optional.of(Constant.ONE);
            }
            return Optional.empty();
        });
    }

    /**
     * {@code b^(-e)} becomes {@code 1 / b^e}.
     */
    public static Rule negativeExponent() {
        return RewriteRule.of("negative-exponent", NEGATIVE_EXPONENT_PRIORITY, expression -> {
            if (expression instanceof Power && isUnary(((Power) expression).getExponent(), UnaryOp.NEGATE)) {
                Power power = (Power) expression;
                Power positive = Power.of(power.getBase(), argument(power.getExponent()));
                return Optional.of(Unary.of(UnaryOp.INVERT, positive));
            }
            return Optional.empty();
        });
    }
}
