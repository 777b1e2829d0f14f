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
 * A rule was asked to transform an expression it did not just match. This is a programming error in the
 * caller of the rule.
 */
public class RuleContractViolationException extends IllegalStateException {
    public RuleContractViolationException(String rule, Expression expression) {
        super("Rule " + rule + " cannot transform " + expression + " without a preceding successful match");
    }
}
