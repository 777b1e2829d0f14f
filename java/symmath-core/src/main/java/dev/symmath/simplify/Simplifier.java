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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.symmath.api.Expression;
import dev.symmath.api.expressions.*;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule based simplifier.
 * <p>
 * An expression goes through three phases: pre-processing, processing and post-processing. Each phase
 * rewrites the tree bottom-up until no rule of the phase matches anywhere. At every node the matching rule
 * with the highest priority is applied; ties go to the rule registered first. After a rewrite the result is
 * simplified again from its leaves, so a rule may rely on the arguments of its input being fully
 * simplified.
 * <p>
 * Results of each phase are memoized for expressions whose complexity lies in the band configured by
 * {@link SimplifierOptions}. Rules keep state between match and transform, so a {@code Simplifier} must
 * not be shared between threads.
 */
public final class Simplifier {
    private static final Logger log = LoggerFactory.getLogger(Simplifier.class);

    private final SimplifierOptions options;
    private final Phase pre;
    private final Phase processing;
    private final Phase post;

    public Simplifier() {
        this(SimplifierOptions.of());
    }

    public Simplifier(SimplifierOptions options) {
        this(options, defaultPreRules(), defaultRules(), defaultPostRules());
    }

    public Simplifier(
            SimplifierOptions options,
            List<? extends Rule> preRules,
            List<? extends Rule> rules,
            List<? extends Rule> postRules) {
        this.options = checkNotNull(options, "options");
        this.pre = new Phase("pre", preRules);
        this.processing = new Phase("processing", rules);
        this.post = new Phase("post", postRules);
    }

    /**
     * Rules that bring an arbitrary tree into the shape the processing rules expect.
     */
    public static List<Rule> defaultPreRules() {
        return ImmutableList.of(StructuralRules.flatten(), StructuralRules.extractNegativeLiteral());
    }

    public static List<Rule> defaultRules() {
        return ImmutableList.of(
                StructuralRules.sortArguments(),
                StructuralRules.flatten(),
                StructuralRules.pullNegationOutOfProduct(),
                StructuralRules.pullNegationOutOfInverse(),
                IdentityRules.doubleNegation(),
                IdentityRules.doubleInversion(),
                IdentityRules.logOfExp(),
                IdentityRules.expOfLog(),
                IdentityRules.elementaryValues(),
                IdentityRules.powerIdentities(),
                ConstantFolding.foldSum(),
                ConstantFolding.foldProduct(),
                ConstantFolding.foldInverse(),
                ConstantFolding.foldPower(),
                IdentityRules.negativeExponent(),
                CollectionRules.collectLikeTerms(),
                CollectionRules.collectLikeFactors());
    }

    /**
     * Rules that only change how a result reads, such as {@code x - 5} instead of {@code -5 + x}.
     */
    public static List<Rule> defaultPostRules() {
        return ImmutableList.of(StructuralRules.leadWithPositiveTerm(), StructuralRules.leadWithNumerator());
    }

    public SimplifierOptions getOptions() {
        return options;
    }

    public ImmutableList<Rule> preRules() {
        return pre.rules;
    }

    public ImmutableList<Rule> processingRules() {
        return processing.rules;
    }

    public ImmutableList<Rule> postRules() {
        return post.rules;
    }

    /**
     * Simplify an expression into an equivalent one that is at most as complex.
     *
     * @throws SimplificationDidNotConvergeException if more than {@link SimplifierOptions#maxSteps()} rules
     *     had to be applied
     */
    public Expression simplify(Expression expression) {
        checkNotNull(expression, "expression");
        Steps steps = new Steps(options.maxSteps());
        Expression result = post.apply(processing.apply(pre.apply(expression, steps), steps), steps);
        log.debug("Simplified {} (size {}) to {} in {} steps", expression, expression.size(), result, steps.count);
        return result;
    }

    /**
     * Memoization statistics, by phase name.
     */
    public ImmutableMap<String, CacheStats> cacheStats() {
        return ImmutableMap.of(
                pre.name, pre.cache.stats(),
                processing.name, processing.cache.stats(),
                post.name, post.cache.stats());
    }

    public void clearCache() {
        pre.cache.invalidateAll();
        processing.cache.invalidateAll();
        post.cache.invalidateAll();
    }

    private boolean cacheable(Expression expression) {
        int complexity = expression.complexity();
        return complexity >= options.minCachedComplexity() && complexity <= options.maxCachedComplexity();
    }

    /** Rule applications done by a single {@link #simplify} call. */
    private static final class Steps {
        private final int limit;
        private int count;

        Steps(int limit) {
            this.limit = limit;
        }

        void increment(Rule rule) {
            if (++count > limit) {
                throw new SimplificationDidNotConvergeException(limit, rule.name());
            }
        }
    }

    private final class Phase {
        private final String name;
        private final ImmutableList<Rule> rules;
        private final Cache<Expression, Expression> cache;

        Phase(String name, List<? extends Rule> rules) {
            this.name = name;
            this.rules = ImmutableList.copyOf(rules);
            this.cache = CacheBuilder.newBuilder()
                    .maximumSize(options.cacheSize())
                    .recordStats()
                    .build();
        }

        Expression apply(Expression expression, Steps steps) {
            boolean cacheable = cacheable(expression);
            if (cacheable) {
                Expression cached = cache.getIfPresent(expression);
                if (cached != null) {
                    return cached;
                }
            }

            Expression current = applyToArguments(expression, steps);
            Rule best = bestMatch(current);
            while (best != null) {
                steps.increment(best);
                Expression rewritten = best.transform(current);
                if (log.isTraceEnabled()) {
                    log.trace("[{}] {}: {} -> {}", name, best.name(), current, rewritten);
                }
                current = applyToArguments(rewritten, steps);
                best = bestMatch(current);
            }

            if (cacheable) {
                cache.put(expression, current);
            }
            return current;
        }

        private Rule bestMatch(Expression expression) {
            Rule best = null;
            int bestPriority = -1;
            for (Rule rule : rules) {
                int priority = rule.match(expression);
                if (priority > bestPriority) {
                    best = rule;
                    bestPriority = priority;
                }
            }
            return best;
        }

        private Expression applyToArguments(Expression expression, Steps steps) {
            return expression.accept(new Expression.Visitor<Expression>() {
                @Override
                public Expression visitConstant(Constant constant) {
                    return constant;
                }

                @Override
                public Expression visitVariable(Variable variable) {
                    return variable;
                }

                @Override
                public Expression visitUnary(Unary unary) {
                    Expression argument = apply(unary.getArgument(), steps);
                    return argument == unary.getArgument() ? unary : unary.withArgument(argument);
                }

                @Override
                public Expression visitAssociative(Associative associative) {
                    List<Expression> arguments = new ArrayList<>(associative.getArgumentCount());
                    boolean changed = false;
                    for (Expression argument : associative.getArguments()) {
                        Expression simplified = apply(argument, steps);
                        changed |= simplified != argument;
                        arguments.add(simplified);
                    }
                    return changed ? associative.withArguments(arguments) : associative;
                }

                @Override
                public Expression visitPower(Power power) {
                    Expression base = apply(power.getBase(), steps);
                    Expression exponent = apply(power.getExponent(), steps);
                    if (base == power.getBase() && exponent == power.getExponent()) {
                        return power;
                    }
                    return power.withArguments(base, exponent);
                }
            });
        }
    }
}
