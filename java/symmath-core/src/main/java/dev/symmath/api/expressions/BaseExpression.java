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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import dev.symmath.api.Expression;

/**
 * Shared bookkeeping for every node: the structural attributes are computed once at construction.
 */
abstract class BaseExpression implements Expression {
    private final boolean constant;
    private final int height;
    private final int size;
    private final int complexity;
    private final int hashCode;

    BaseExpression(boolean constant, int height, int size, int complexity, int hashCode) {
        this.constant = constant;
        this.height = height;
        this.size = size;
        this.complexity = complexity;
        this.hashCode = hashCode;
    }

    @Override
    public final boolean isConstant() {
        return constant;
    }

    @Override
    public double value() {
        checkState(constant, "%s is not constant", this);
        return evaluate(ImmutableMap.of());
    }

    @Override
    public final int height() {
        return height;
    }

    @Override
    public final int size() {
        return size;
    }

    @Override
    public final int complexity() {
        return complexity;
    }

    @Override
    public final int hashCode() {
        return hashCode;
    }
}
