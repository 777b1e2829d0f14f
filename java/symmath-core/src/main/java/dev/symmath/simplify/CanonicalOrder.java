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

import dev.symmath.api.Expression;
import dev.symmath.api.expressions.*;
import java.util.Comparator;
import java.util.List;

/**
 * Total order used to sort the arguments of sums and products.
 * <p>
 * Constants come before everything else, simpler expressions before more complex ones, literals before
 * compound constants and in numeric order. Remaining ties are broken structurally so the order is total.
 */
public final class CanonicalOrder implements Comparator<Expression> {
    public static final CanonicalOrder INSTANCE = new CanonicalOrder();

    private static final Expression.Visitor<Integer> KIND = new Expression.Visitor<Integer>() {
        @Override
        public Integer visitConstant(Constant constant) {
            return 0;
        }

        @Override
        public Integer visitVariable(Variable variable) {
            return 1;
        }

        @Override
        public Integer visitUnary(Unary unary) {
            return 2;
        }

        @Override
        public Integer visitPower(Power power) {
            return 3;
        }

        @Override
        public Integer visitAssociative(Associative associative) {
            return 4;
        }
    };

    private CanonicalOrder() {}

    public boolean isSorted(List<? extends Expression> expressions) {
        for (int i = 1; i < expressions.size(); i++) {
            if (compare(expressions.get(i - 1), expressions.get(i)) > 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compare(Expression left, Expression right) {
        if (left == right) {
            return 0;
        }
        if (left.isConstant() != right.isConstant()) {
            return left.isConstant() ? -1 : 1;
        }
        int result = Integer.compare(left.complexity(), right.complexity());
        if (result != 0) {
            return result;
        }
        boolean leftLiteral = left instanceof Constant;
        boolean rightLiteral = right instanceof Constant;
        if (leftLiteral && rightLiteral) {
            return Double.compare(left.value(), right.value());
        }
        if (leftLiteral != rightLiteral) {
            return leftLiteral ? -1 : 1;
        }
        return compareStructure(left, right);
    }

    private int compareStructure(Expression left, Expression right) {
        int result = Integer.compare(left.accept(KIND), right.accept(KIND));
        if (result != 0) {
            return result;
        }
        if (left instanceof Variable) {
            return ((Variable) left).getName().compareTo(((Variable) right).getName());
        }
        if (left instanceof Unary) {
            Unary l = (Unary) left;
            Unary r = (Unary) right;
            result = l.getOperator().compareTo(r.getOperator());
            return result != 0 ? result : compare(l.getArgument(), r.getArgument());
        }
        if (left instanceof Power) {
            Power l = (Power) left;
            Power r = (Power) right;
            result = compare(l.getBase(), r.getBase());
            return result != 0 ? result : compare(l.getExponent(), r.getExponent());
        }
        if (left instanceof Associative) {
            Associative l = (Associative) left;
            Associative r = (Associative) right;
            result = l.getOperator().compareTo(r.getOperator());
            if (result != 0) {
                return result;
            }
            result = Integer.compare(l.getArgumentCount(), r.getArgumentCount());
            for (int i = 0; result == 0 && i < l.getArgumentCount(); i++) {
                result = compare(l.getArguments().get(i), r.getArguments().get(i));
            }
            return result;
        }
        return 0;
    }
}
