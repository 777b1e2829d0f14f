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
package dev.symmath.api;

import com.google.common.collect.ImmutableMap;
import dev.symmath.api.expressions.*;
import java.util.Map;

/**
 * An immutable tree representing a closed-form expression over real variables and constants.
 * <p>
 * Every transformation returns a new tree, so subtrees can be shared freely between trees and threads.
 * The only way to build a tree is through the static {@code of} factories of the node types and the
 * combinators declared here.
 */
public interface Expression {
    String type();

    /**
     * True when no {@link Variable} occurs in this tree, in which case {@link #value()} is defined.
     */
    boolean isConstant();

    /**
     * The value of a constant expression.
     *
     * @throws IllegalStateException if this expression is not constant
     */
    double value();

    /**
     * Number of nodes on the longest path from this node to a leaf, counting both ends.
     */
    int height();

    /**
     * Number of nodes in the tree.
     */
    int size();

    /**
     * Number of nodes that are not literal constants. {@code (3 * (1 / 3))} has complexity 2 while
     * {@code (x * (1 / x))} has complexity 4.
     */
    int complexity();

    /**
     * Evaluate with IEEE double semantics.
     *
     * @throws UnboundVariableException if a variable of the tree has no binding
     */
    double evaluate(Map<Variable, Double> bindings);

    default double evaluate() {
        return evaluate(ImmutableMap.of());
    }

    /**
     * Structural substitution of the bound variables. Nothing is evaluated or simplified.
     */
    Expression with(Map<Variable, Expression> bindings);

    default Expression withValues(Map<Variable, Double> values) {
        ImmutableMap.Builder<Variable, Expression> bindings = ImmutableMap.builder();
        values.forEach((variable, value) -> bindings.put(variable, Constant.of(value)));
        return with(bindings.build());
    }

    /**
     * The symbolic derivative with respect to {@code variable}. The result is not simplified.
     */
    Expression derivative(Variable variable);

    default Expression derivative(String variable) {
        return derivative(Variable.of(variable));
    }

    <T> T accept(Visitor<T> visitor);

    default Expression add(Expression other) {
        return Associative.flatten(Associative.AssociativeOp.SUM, this, other);
    }

    default Expression subtract(Expression other) {
        return add(other.negate());
    }

    default Expression multiply(Expression other) {
        return Associative.flatten(Associative.AssociativeOp.PRODUCT, this, other);
    }

    default Expression divide(Expression other) {
        if (Constant.isLiteral(this, 1.0)) {
            return other.invert();
        }
        return multiply(other.invert());
    }

    default Expression pow(Expression exponent) {
        return Power.of(this, exponent);
    }

    default Expression negate() {
        return Unary.of(Unary.UnaryOp.NEGATE, this);
    }

    default Expression invert() {
        return Unary.of(Unary.UnaryOp.INVERT, this);
    }

    default Expression exp() {
        return Unary.of(Unary.UnaryOp.EXP, this);
    }

    default Expression log() {
        return Unary.of(Unary.UnaryOp.LOG, this);
    }

    default Expression sin() {
        return Unary.of(Unary.UnaryOp.SIN, this);
    }

    default Expression cos() {
        return Unary.of(Unary.UnaryOp.COS, this);
    }

    default Expression tan() {
        return Unary.of(Unary.UnaryOp.TAN, this);
    }

    interface Visitor<T> {
        T visitConstant(Constant constant);

        T visitVariable(Variable variable);

        T visitUnary(Unary unary);

        T visitAssociative(Associative associative);

        T visitPower(Power power);
    }
}
