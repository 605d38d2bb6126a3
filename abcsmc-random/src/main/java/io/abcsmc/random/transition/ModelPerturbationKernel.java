package io.abcsmc.random.transition;

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

/**
 * Discrete transition kernel over model indices.
 *
 * <p>From a source model the kernel stays with probability
 * {@code probabilityToStay} and otherwise jumps uniformly to one of the other
 * models. With a single model it always stays.
 *
 * <pre>{@code
 *   pmf(target | source) = probabilityToStay                   if target == source
 *                        = (1 - probabilityToStay) / (n - 1)   otherwise
 * }</pre>
 */
public final class ModelPerturbationKernel {

    public static final double DEFAULT_PROBABILITY_TO_STAY = 0.7;

    private final int nrModels;
    private final double probabilityToStay;

    public ModelPerturbationKernel(int nrModels) {
        this(nrModels, DEFAULT_PROBABILITY_TO_STAY);
    }

    /**
     * @param nrModels number of models
     * @param probabilityToStay probability of keeping the source model, in [0, 1]
     * @throws IllegalArgumentException if nrModels is below 1 or the probability is outside [0, 1]
     */
    public ModelPerturbationKernel(int nrModels, double probabilityToStay) {
        if (nrModels < 1) {
            throw new IllegalArgumentException("Need at least one model, got: " + nrModels);
        }
        if (!(probabilityToStay >= 0.0 && probabilityToStay <= 1.0)) {
            throw new IllegalArgumentException("probabilityToStay must be in [0, 1], got: " + probabilityToStay);
        }
        this.nrModels = nrModels;
        this.probabilityToStay = nrModels == 1 ? 1.0 : probabilityToStay;
    }

    /**
     * @param source source model index
     * @param rng random source
     * @return target model index
     */
    public int rvs(int source, UniformRandomProvider rng) {
        checkIndex(source);
        if (nrModels == 1 || rng.nextDouble() < probabilityToStay) {
            return source;
        }
        int other = rng.nextInt(nrModels - 1);
        return other >= source ? other + 1 : other;
    }

    /**
     * @param target target model index
     * @param source source model index
     * @return probability of moving from source to target
     */
    public double pmf(int target, int source) {
        checkIndex(target);
        checkIndex(source);
        if (target == source) {
            return probabilityToStay;
        }
        return (1.0 - probabilityToStay) / (nrModels - 1);
    }

    public int getNrModels() {
        return nrModels;
    }

    public double getProbabilityToStay() {
        return probabilityToStay;
    }

    private void checkIndex(int model) {
        if (model < 0 || model >= nrModels) {
            throw new IllegalArgumentException("Model index " + model + " out of range [0, " + nrModels + ")");
        }
    }
}
