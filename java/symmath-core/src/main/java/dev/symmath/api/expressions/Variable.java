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

import com.google.common.base.Strings;
import dev.symmath.api.Expression;
import dev.symmath.api.UnboundVariableException;
import java.util.Map;

/**
 * A named real variable. Two variables are the same variable when their names are equal.
 */
public final class Variable extends BaseExpression {
    private final String name;

    private Variable(String name) {
        super(false, 1, 1, 1, name.hashCode());
        this.name = name;
    }

    public static Variable of(String name) {
        checkArgument(!Strings.isNullOrEmpty(name), "Variable names cannot be null or empty");
        return new Variable(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public String type() {
        return "variable";
    }

    @Override
    public double evaluate(Map<Variable, Double> bindings) {
        Double value = bindings.get(this);
        if (value == null) {
            throw new UnboundVariableException(this);
        }
        return value;
    }

    @Override
    public Expression with(Map<Variable, Expression> bindings) {
        Expression replacement = bindings.get(this);
        return replacement == null ? this : replacement;
    }

    @Override
    public Expression derivative(Variable variable) {
        return equals(variable) ? Constant.ONE : Constant.ZERO;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Variable)) return false;
        return name.equals(((Variable) o).name);
    }

    @Override
    public String toString() {
        return name;
    }
}
