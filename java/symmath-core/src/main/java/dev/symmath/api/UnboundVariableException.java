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

import dev.symmath.api.expressions.Variable;

/**
 * Thrown when an expression is evaluated without a value for one of its variables.
 */
public class UnboundVariableException extends RuntimeException {
    private final Variable variable;

    public UnboundVariableException(Variable variable) {
        super("No value bound for variable " + variable);
        this.variable = variable;
    }

    public Variable getVariable() {
        return variable;
    }
}
