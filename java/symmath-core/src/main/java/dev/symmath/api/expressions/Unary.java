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

import static com.google.common.base.Preconditions.checkNotNull;

import dev.symmath.api.Expression;
import java.util.Map;
import java.util.Objects;

/**
 * A single-argument function: negation, inversion ({@code 1 / u}), and the elementary functions.
 */
public final class Unary extends BaseExpression {
    private static final Constant TWO = Constant.of(2.0);

    private final UnaryOp operator;
    private final Expression argument;

    private Unary(UnaryOp operator, Expression argument) {
        super(
                argument.isConstant(),
                argument.height() + 1,
                argument.size() + 1,
                argument.complexity() + 1,
                Objects.hash(operator.ordinal(), argument));
        this.operator = operator;
        this.argument = argument;
    }

    public static Unary of(UnaryOp operator, Expression argument) {
        return new Unary(checkNotNull(operator, "operator"), checkNotNull(argument, "argument"));
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getArgument() {
        return argument;
    }

    public boolean is(UnaryOp op) {
        return operator == op;
    }

    /**
     * The same function applied to a different argument.
     */
    public Unary withArgument(Expression newArgument) {
        return newArgument == argument ? this : of(operator, newArgument);
    }

    @Override
    public String type() {
        return "unary";
    }

    @Override
    public double evaluate(Map<Variable, Double> bindings) {
        return operator.apply(argument.evaluate(bindings));
    }

    @Override
    public Expression with(Map<Variable, Expression> bindings) {
        return withArgument(argument.with(bindings));
    }

    @Override
    public Expression derivative(Variable variable) {
        Expression du = argument.derivative(variable);
        switch (operator) {
            case NEGATE:
                return du.negate();
            case INVERT:
                return du.divide(argument.pow(TWO)).negate();
            case EXP:
                return multiply(du);
            case LOG:
                return du.divide(argument);
            case SIN:
                return argument.cos().multiply(du);
            case COS:
                return argument.sin().negate().multiply(du);
            case TAN:
                return du.divide(argument.cos().pow(TWO));
            default:
                throw new IllegalStateException("Unknown UnaryOp: " + operator);
        }
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Unary other = (Unary) o;
        return hashCode() == other.hashCode() && operator == other.operator && argument.equals(other.argument);
    }

    @Override
    public String toString() {
        switch (operator) {
            case NEGATE:
                return "(-" + argument + ")";
            case INVERT:
                return "(1 / " + argument + ")";
            default:
                return operator + "(" + argument + ")";
        }
    }

    public enum UnaryOp {
        NEGATE,
        INVERT,
        EXP,
        LOG,
        SIN,
        COS,
        TAN,
        ;

        public double apply(double value) {
            switch (this) {
                case NEGATE:
                    return -value;
                case INVERT:
                    return 1.0 / value;
                case EXP:
                    return Math.exp(value);
                case LOG:
                    return Math.log(value);
                case SIN:
                    return Math.sin(value);
                case COS:
                    return Math.cos(value);
                case TAN:
                    return Math.tan(value);
                default:
                    throw new IllegalStateException("Unknown UnaryOp: " + this);
            }
        }

        @Override
        public String toString() {
            switch (this) {
                case NEGATE:
                    return "-";
                case INVERT:
                    return "1/";
                case EXP:
                    return "exp";
                case LOG:
                    return "ln";
                case SIN:
                    return "sin";
                case COS:
                    return "cos";
                case TAN:
                    return "tan";
                default:
                    throw new IllegalStateException("Unknown UnaryOp: " + this.name());
            }
        }
    }
}
