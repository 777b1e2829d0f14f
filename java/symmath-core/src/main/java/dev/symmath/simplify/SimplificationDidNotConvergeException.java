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

/**
 * Thrown when a simplification needs more rule applications than {@link SimplifierOptions#maxSteps()}.
 * Usually a sign of rules that keep rewriting each other's output.
 */
public class SimplificationDidNotConvergeException extends RuntimeException {
    private final int steps;

    public SimplificationDidNotConvergeException(int steps, String lastRule) {
        super("Simplification did not converge after " + steps + " steps, last rule applied: " + lastRule);
        this.steps = steps;
    }

    public int getSteps() {
        return steps;
    }
}
