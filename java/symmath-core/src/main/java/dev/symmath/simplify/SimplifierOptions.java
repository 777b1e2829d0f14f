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

import java.util.Map;
import org.immutables.value.Value;

/**
 * Tuning knobs of a {@link Simplifier}.
 */
@Value.Immutable
public interface SimplifierOptions {
    String MAX_STEPS = "symmath.simplifier.max-steps";
    String MIN_CACHED_COMPLEXITY = "symmath.simplifier.min-cached-complexity";
    String MAX_CACHED_COMPLEXITY = "symmath.simplifier.max-cached-complexity";
    String CACHE_SIZE = "symmath.simplifier.cache-size";

    /**
     * Maximum number of rule applications in one call to {@link Simplifier#simplify}.
     */
    @Value.Default
    default int maxSteps() {
        return 100_000;
    }

    /**
     * Expressions below this complexity are cheaper to simplify again than to look up.
     */
    @Value.Default
    default int minCachedComplexity() {
        return 3;
    }

    /**
     * Expressions above this complexity are unlikely to be seen twice and are not memoized.
     */
    @Value.Default
    default int maxCachedComplexity() {
        return 256;
    }

    /**
     * Maximum number of memoized results per phase. Zero disables memoization.
     */
    @Value.Default
    default long cacheSize() {
        return 10_000;
    }

    @Value.Check
    default void check() {
        checkArgument(maxSteps() > 0, "maxSteps must be positive: %s", maxSteps());
        checkArgument(minCachedComplexity() >= 0, "minCachedComplexity must not be negative");
        checkArgument(
                minCachedComplexity() <= maxCachedComplexity(),
                "cached complexity band is empty: [%s, %s]",
                minCachedComplexity(),
                maxCachedComplexity());
        checkArgument(cacheSize() >= 0, "cacheSize must not be negative: %s", cacheSize());
    }

    static SimplifierOptions of() {
        return ImmutableSimplifierOptions.builder().build();
    }

    static ImmutableSimplifierOptions.Builder builder() {
        return ImmutableSimplifierOptions.builder();
    }

    /**
     * Read options from {@code symmath.simplifier.*} keys, falling back to the defaults for absent keys.
     *
     * @throws IllegalArgumentException if a value is not a number or out of range
     */
    static SimplifierOptions fromProperties(Map<?, ?> properties) {
        ImmutableSimplifierOptions.Builder builder = builder();
        if (properties.containsKey(MAX_STEPS)) {
            builder.maxSteps(parse(properties, MAX_STEPS).intValue());
        }
        if (properties.containsKey(MIN_CACHED_COMPLEXITY)) {
            builder.minCachedComplexity(parse(properties, MIN_CACHED_COMPLEXITY).intValue());
        }
        if (properties.containsKey(MAX_CACHED_COMPLEXITY)) {
            builder.maxCachedComplexity(parse(properties, MAX_CACHED_COMPLEXITY).intValue());
        }
        if (properties.containsKey(CACHE_SIZE)) {
            builder.cacheSize(parse(properties, CACHE_SIZE));
        }
        return builder.build();
    }

    private static Long parse(Map<?, ?> properties, String key) {
        String value = String.valueOf(properties.get(key)).trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
