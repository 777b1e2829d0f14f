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

/**
 * A rewrite rule of the {@link Simplifier}.
 */
public interface Rule {
    String name();

    /**
     * Returns the priority of the match, or a negative number if the rule does not apply.
     * When several rules match the same expression the highest priority wins.
     */
    int match(Expression expression);

    /**
     * Rewrite an expression into a mathematically equivalent one. Only valid directly after a successful
     * {@link #match(Expression)} of the very same expression.
     */
    Expression transform(Expression match);
}
