package io.abcsmc.random;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Creates the random number generators used throughout a run. Based on Apache
 * Commons RNG.
 *
 * <p>Every stochastic operation in this project takes an explicit
 * {@link UniformRandomProvider}. Providers are not thread-safe, so concurrent
 * workers each get their own provider derived from a master with
 * {@link #split(UniformRandomProvider)}.
 */
public final class RandomSources {

    /**
     * XorShiRo256++: 256-bit state, fast, good statistical properties in
     * high dimensions.
     */
    public static final RandomSource DEFAULT_SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private RandomSources() {
    }

    /**
     * @param seed seed for deterministic generation
     * @return a new provider of the default algorithm
     */
    public static UniformRandomProvider create(long seed) {
        return DEFAULT_SOURCE.create(seed);
    }

    /**
     * @return a new provider seeded from system entropy
     */
    public static UniformRandomProvider create() {
        return DEFAULT_SOURCE.create();
    }

    /**
     * Creates a seeded provider if a seed is given, an entropy-seeded one otherwise.
     *
     * @param seed optional seed, may be null
     * @return a new provider
     */
    public static UniformRandomProvider create(Long seed) {
        return seed == null ? create() : create(seed.longValue());
    }

    /**
     * Derives an independent provider from a master. The master advances by
     * one draw.
     *
     * @param master the master provider
     * @return a new provider seeded from the master
     */
    public static UniformRandomProvider split(UniformRandomProvider master) {
        return DEFAULT_SOURCE.create(master.nextLong());
    }

    /**
     * Draws an index from a discrete distribution by inverse CDF.
     *
     * @param cumulative non-decreasing cumulative weights; the last entry is the total
     * @param rng random source
     * @return an index i with probability proportional to its weight
     * @throws IllegalArgumentException if the total weight is not positive
     */
    public static int sampleIndex(double[] cumulative, UniformRandomProvider rng) {
        double total = cumulative[cumulative.length - 1];
        if (!(total > 0.0)) {
            throw new IllegalArgumentException("Total weight must be positive, got: " + total);
        }
        double u = rng.nextDouble() * total;
        for (int i = 0; i < cumulative.length; i++) {
            if (u < cumulative[i]) {
                return i;
            }
        }
        // u rounded up to total; pick the last index with positive mass
        for (int i = cumulative.length - 1; i > 0; i--) {
            if (cumulative[i] > cumulative[i - 1]) {
                return i;
            }
        }
        return 0;
    }

    /**
     * @param weights non-negative weights
     * @return running sums of the weights
     */
    public static double[] cumulative(double[] weights) {
        double[] cumulative = new double[weights.length];
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            sum += weights[i];
            cumulative[i] = sum;
        }
        return cumulative;
    }
}
