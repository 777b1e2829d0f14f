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

import com.google.common.collect.ImmutableList;
import dev.symmath.api.expressions.Associative;
import dev.symmath.api.expressions.Associative.AssociativeOp;
import dev.symmath.api.expressions.Constant;
import dev.symmath.api.expressions.Variable;
import java.util.Arrays;
import java.util.List;

/**
 * Static construction helpers.
 */
public final class Expressions {
    private Expressions() {}

    public static Constant constant(double value) {
        return Constant.of(value);
    }

    public static Variable variable(String name) {
        return Variable.of(name);
    }

    /**
     * Sum of the terms: {@code 0} for no terms, the term itself for one, else a flattened sum.
     */
    public static Expression sum(List<? extends Expression> terms) {
        return combine(AssociativeOp.SUM, terms);
    }

    public static Expression sum(Expression... terms) {
        return sum(Arrays.asList(terms));
    }

    /**
     * Product of the factors: {@code 1} for no factors, the factor itself for one, else a flattened product.
     */
    public static Expression product(List<? extends Expression> factors) {
        return combine(AssociativeOp.PRODUCT, factors);
    }

    public static Expression product(Expression... factors) {
        return product(Arrays.asList(factors));
    }

    private static Expression combine(AssociativeOp operator, List<? extends Expression> arguments) {
        ImmutableList.Builder<Expression> flat = ImmutableList.builder();
        for (Expression argument : arguments) {
            if (argument instanceof Associative && ((Associative) argument).is(operator)) {
                flat.addAll(((Associative) argument).getArguments());
            } else {
                flat.add(argument);
            }
        }
        ImmutableList<Expression> args = flat.build();
        switch (args.size()) {
            case 0:
                return Constant.of(operator.identity());
            case 1:
                return args.get(0);
            default:
                return Associative.of(operator, args);
        }
    }

    public static Expression exp(Expression argument) {
        return argument.exp();
    }

    public static Expression ln(Expression argument) {
        return argument.log();
    }

    public static Expression sin(Expression argument) {
        return argument.sin();
    }

    public static Expression cos(Expression argument) {
        return argument.cos();
    }

    public static Expression tan(Expression argument) {
        return argument.tan();
    }
}
