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
 * {@code base ^ exponent}, with the real semantics of {@link Math#pow(double, double)}.
 */
public final class Power extends BaseExpression {
    private final Expression base;
    private final Expression exponent;

    private Power(Expression base, Expression exponent) {
        super(
                base.isConstant() && exponent.isConstant(),
                Math.max(base.height(), exponent.height()) + 1,
                base.size() + exponent.size() + 1,
                base.complexity() + exponent.complexity() + 1,
                Objects.hash(base, exponent));
        this.base = base;
        this.exponent = exponent;
    }

    public static Power of(Expression base, Expression exponent) {
        return new Power(checkNotNull(base, "base"), checkNotNull(exponent, "exponent"));
    }

    public Expression getBase() {
        return base;
    }

    public Expression getExponent() {
        return exponent;
    }

    public Power withArguments(Expression newBase, Expression newExponent) {
        return newBase == base && newExponent == exponent ? this : of(newBase, newExponent);
    }

    @Override
    public String type() {
        return "power";
    }

    @Override
    public double evaluate(Map<Variable, Double> bindings) {
        return Math.pow(base.evaluate(bindings), exponent.evaluate(bindings));
    }

    @Override
    public Expression with(Map<Variable, Expression> bindings) {
        return withArguments(base.with(bindings), exponent.with(bindings));
    }

    @Override
    public Expression derivative(Variable variable) {
        boolean constantBase = base.isConstant();
        boolean constantExponent = exponent.isConstant();
        if (constantBase && constantExponent) {
            return Constant.ZERO;
        }
        if (constantExponent) {
            // n * u^(n - 1) * du
            return exponent.multiply(base.pow(exponent.subtract(Constant.ONE))).multiply(base.derivative(variable));
        }
        if (constantBase) {
            // ln(c) * c^v * dv
            return base.log().multiply(this).multiply(exponent.derivative(variable));
        }
        // u^(v - 1) * (v * du + u * ln(u) * dv)
        Expression du = base.derivative(variable);
        Expression dv = exponent.derivative(variable);
        return base.pow(exponent.subtract(Constant.ONE))
                .multiply(exponent.multiply(du).add(base.multiply(base.log()).multiply(dv)));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitPower(this);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Power other = (Power) o;
        return hashCode() == other.hashCode() && base.equals(other.base) && exponent.equals(other.exponent);
    }

    @Override
    public String toString() {
        return "(" + base + " ^ " + exponent + ")";
    }
}
