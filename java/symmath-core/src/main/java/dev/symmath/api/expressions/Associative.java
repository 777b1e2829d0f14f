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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import dev.symmath.api.Expression;
import java.util.List;
import java.util.Map;

/**
 * A flattened n-ary sum or product. Argument order carries no meaning: two nodes are equal when they
 * hold the same multiset of arguments.
 */
public final class Associative extends BaseExpression {
    private final AssociativeOp operator;
    private final ImmutableList<Expression> arguments;

    private Associative(AssociativeOp operator, ImmutableList<Expression> arguments) {
        super(
                arguments.stream().allMatch(Expression::isConstant),
                arguments.stream().mapToInt(Expression::height).max().orElse(0) + 1,
                arguments.stream().mapToInt(Expression::size).sum() + 1,
                arguments.stream().mapToInt(Expression::complexity).sum() + 1,
                31 * (operator.ordinal() + 1)
                        + arguments.stream().mapToInt(Expression::hashCode).sum());
        this.operator = operator;
        this.arguments = arguments;
    }

    public static Associative of(AssociativeOp operator, List<? extends Expression> arguments) {
        checkNotNull(operator, "operator");
        ImmutableList<Expression> args = ImmutableList.copyOf(arguments);
        checkArgument(args.size() >= 2, "%s needs at least two arguments, got %s", operator, args.size());
        return new Associative(operator, args);
    }

    public static Associative of(AssociativeOp operator, Expression first, Expression second, Expression... rest) {
        return of(
                operator,
                ImmutableList.<Expression>builder()
                        .add(first, second)
                        .add(rest)
                        .build());
    }

    /**
     * Combine two operands into one node, splicing in the arguments of operands that already are
     * {@code operator} nodes.
     */
    public static Associative flatten(AssociativeOp operator, Expression left, Expression right) {
        ImmutableList.Builder<Expression> args = ImmutableList.builder();
        addFlattened(args, operator, left);
        addFlattened(args, operator, right);
        return new Associative(operator, args.build());
    }

    private static void addFlattened(ImmutableList.Builder<Expression> args, AssociativeOp operator, Expression e) {
        checkNotNull(e, "operand");
        if (e instanceof Associative && ((Associative) e).operator == operator) {
            args.addAll(((Associative) e).arguments);
        } else {
            args.add(e);
        }
    }

    public AssociativeOp getOperator() {
        return operator;
    }

    public boolean is(AssociativeOp op) {
        return operator == op;
    }

    public ImmutableList<Expression> getArguments() {
        return arguments;
    }

    public int getArgumentCount() {
        return arguments.size();
    }

    public Associative withArguments(List<? extends Expression> newArguments) {
        return of(operator, newArguments);
    }

    @Override
    public String type() {
        return "associative";
    }

    @Override
    public double evaluate(Map<Variable, Double> bindings) {
        double result = operator.identity();
        for (Expression argument : arguments) {
            result = operator.apply(result, argument.evaluate(bindings));
        }
        return result;
    }

    @Override
    public Expression with(Map<Variable, Expression> bindings) {
        ImmutableList.Builder<Expression> newArguments = ImmutableList.builder();
        boolean changed = false;
        for (Expression argument : arguments) {
            Expression replaced = argument.with(bindings);
            changed |= replaced != argument;
            newArguments.add(replaced);
        }
        return changed ? new Associative(operator, newArguments.build()) : this;
    }

    @Override
    public Expression derivative(Variable variable) {
        if (operator == AssociativeOp.SUM) {
            ImmutableList.Builder<Expression> terms = ImmutableList.builder();
            for (Expression argument : arguments) {
                terms.add(argument.derivative(variable));
            }
            return new Associative(AssociativeOp.SUM, terms.build());
        }
        return productDerivative(arguments, variable);
    }

    // d(u * v) = v * du + u * dv, with v the product of every factor after the first
    private static Expression productDerivative(List<Expression> factors, Variable variable) {
        Expression u = factors.get(0);
        Expression v = factors.size() == 2
                ? factors.get(1)
                : new Associative(AssociativeOp.PRODUCT, ImmutableList.copyOf(factors.subList(1, factors.size())));
        return v.multiply(u.derivative(variable)).add(u.multiply(v.derivative(variable)));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitAssociative(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Associative other = (Associative) o;
        if (operator != other.operator
                || hashCode() != other.hashCode()
                || arguments.size() != other.arguments.size()) {
            return false;
        }
        if (arguments.equals(other.arguments)) {
            return true;
        }
        return HashMultiset.create(arguments).equals(HashMultiset.create(other.arguments));
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("(");
        for (int i = 0; i < arguments.size(); i++) {
            Expression argument = arguments.get(i);
            boolean inverse = argument instanceof Unary && ((Unary) argument).is(operator.inverse());
            Expression shown = inverse ? ((Unary) argument).getArgument() : argument;
            if (i == 0) {
                if (inverse && operator == AssociativeOp.PRODUCT) {
                    result.append("1 / ").append(shown);
                } else {
                    result.append(argument);
                }
            } else {
                result.append(' ')
                        .append(inverse ? operator.inverseSymbol() : operator.symbol())
                        .append(' ')
                        .append(shown);
            }
        }
        return result.append(')').toString();
    }

    public enum AssociativeOp {
        SUM,
        PRODUCT,
        ;

        public double identity() {
            return this == SUM ? 0.0 : 1.0;
        }

        public double apply(double left, double right) {
            return this == SUM ? left + right : left * right;
        }

        /**
         * The unary function whose arguments render as the inverse operation inside this node.
         */
        public Unary.UnaryOp inverse() {
            return this == SUM ? Unary.UnaryOp.NEGATE : Unary.UnaryOp.INVERT;
        }

        public String symbol() {
            return this == SUM ? "+" : "*";
        }

        public String inverseSymbol() {
            return this == SUM ? "-" : "/";
        }
    }
}
