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
package dev.symmath.series;

import dev.symmath.api.Expression;
import dev.symmath.api.expressions.Variable;
import dev.symmath.parse.Infix;
import dev.symmath.parse.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the Taylor polynomial of an expression around zero.
 * <pre>
 *  TaylorSeriesMain &lt;expression&gt; [variable] [terms]
 * </pre>
 */
public final class TaylorSeriesMain {
    private static final Logger log = LoggerFactory.getLogger(TaylorSeriesMain.class);

    private static final String DEFAULT_EXPRESSION = "sin(x)*cos(x)";
    private static final String DEFAULT_VARIABLE = "x";
    private static final int DEFAULT_TERMS = TaylorSeries.MAX_TERMS;

    private TaylorSeriesMain() {}

    public static void main(String[] args) {
        String text = args.length > 0 ? args[0] : DEFAULT_EXPRESSION;
        String variable = args.length > 1 ? args[1] : DEFAULT_VARIABLE;
        int terms;
        try {
            terms = args.length > 2 ? Integer.parseInt(args[2]) : DEFAULT_TERMS;
        } catch (NumberFormatException e) {
            log.error("Invalid term count: {}", args[2]);
            System.exit(2);
            return;
        }

        Expression function;
        try {
            function = Infix.parse(text);
        } catch (ParseException e) {
            log.error("Cannot parse {}: {}", text, e.getMessage());
            System.exit(2);
            return;
        }
        System.out.println(new TaylorSeries().expand(function, Variable.of(variable), 0.0, terms));
    }
}
