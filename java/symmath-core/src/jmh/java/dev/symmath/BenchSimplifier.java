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
package dev.symmath;

import com.jakewharton.nopen.annotation.Open;
import dev.symmath.api.Expression;
import dev.symmath.api.expressions.Variable;
import dev.symmath.parse.Infix;
import dev.symmath.simplify.Simplifier;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Repeated differentiation of a mixed expression, simplifying after every step.
 */
@BenchmarkMode(value = Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Thread)
@Open
public class BenchSimplifier {
    static final String EXPRESSION = "sin(x) + cos(x/2) + sin(cos(x)) + e^(x^2) + e^(x^2-5) + sin(x^2)";
    static final Variable X = Variable.of("x");

    @Param({"4", "8"})
    int derivatives;

    Expression expression;
    Simplifier shared;

    @Setup(Level.Trial)
    public void setup() {
        expression = Infix.parse(EXPRESSION);
        shared = new Simplifier();
    }

    @Benchmark
    public void derivativesWithSharedSimplifier(Blackhole bh) {
        bh.consume(differentiate(shared));
    }

    @Benchmark
    public void derivativesWithFreshSimplifier(Blackhole bh) {
        bh.consume(differentiate(new Simplifier()));
    }

    private Expression differentiate(Simplifier simplifier) {
        Expression last = expression;
        for (int i = 0; i < derivatives; i++) {
            last = simplifier.simplify(last.derivative(X));
        }
        return last;
    }

    @Benchmark
    public void simplifyRaw(Blackhole bh) {
        bh.consume(new Simplifier().simplify(expression));
    }
}
