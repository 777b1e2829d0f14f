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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import dev.symmath.api.Expression;
import java.util.Optional;
import java.util.function.Function;

/**
 * A {@link Rule} that computes its rewrite while matching and hands it out from {@link #transform(Expression)}.
 * <p>
 * Instances remember the last match and are therefore not thread-safe.
 */
public abstract class RewriteRule implements Rule {
    private final String name;
    private final int priority;

    private Expression matched;
    private Expression rewritten;

    protected RewriteRule(String name, int priority) {
        checkArgument(priority >= 0, "priority must not be negative: %s", priority);
        this.name = checkNotNull(name, "name");
        this.priority = priority;
    }

    public static RewriteRule of(String name, int priority, Function<Expression, Optional<Expression>> function) {
        checkNotNull(function, "function");
        return new RewriteRule(name, priority) {
            @Override
            protected Optional<Expression> rewrite(Expression expression) {
                return function.apply(expression);
            }
        };
    }

    /**
     * The rewritten expression, or empty when this rule does not apply.
     */
    protected abstract Optional<Expression> rewrite(Expression expression);

    @Override
    public String name() {
        return name;
    }

    public int priority() {
        return priority;
    }

    @Override
    public final int match(Expression expression) {
        Optional<Expression> result = rewrite(expression);
        if (result.isPresent()) {
            matched = expression;
            rewritten = result.get();
            return priority;
        }
        matched = null;
        rewritten = null;
        return -1;
    }

    @Override
    public final Expression transform(Expression match) {
        if (matched == null || match != matched) {
            throw new RuleContractViolationException(name, match);
        }
        Expression result = rewritten;
        matched = null;
        rewritten = null;
        return result;
    }

    @Override
    public String toString() {
        return name + "@" + priority;
    }
}
