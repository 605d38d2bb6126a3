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

import java.util.Arrays;

/**
 * Discrete prior over model indices {@code 0..n-1}.
 */
public final class ModelPrior {

    private final double[] probabilities;
    private final double[] cumulative;

    private ModelPrior(double[] probabilities) {
        this.probabilities = probabilities;
        this.cumulative = RandomSources.cumulative(probabilities);
    }

    /**
     * @param nrModels number of models
     * @return the uniform prior over that many models
     */
    public static ModelPrior uniform(int nrModels) {
        if (nrModels < 1) {
            throw new IllegalArgumentException("Need at least one model, got: " + nrModels);
        }
        double[] probabilities = new double[nrModels];
        Arrays.fill(probabilities, 1.0 / nrModels);
        return new ModelPrior(probabilities);
    }

    /**
     * @param weights non-negative weights, normalized internally
     * @return the prior
     * @throws IllegalArgumentException if a weight is negative or not finite, or all are zero
     */
    public static ModelPrior of(double... weights) {
        if (weights.length == 0) {
            throw new IllegalArgumentException("Need at least one model");
        }
        double total = 0.0;
        for (double w : weights) {
            if (!(w >= 0.0) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("Model prior weights must be finite and >= 0: "
                    + Arrays.toString(weights));
            }
            total += w;
        }
        if (!(total > 0.0)) {
            throw new IllegalArgumentException("Model prior weights sum to zero");
        }
        double[] probabilities = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            probabilities[i] = weights[i] / total;
        }
        return new ModelPrior(probabilities);
    }

    public int rvs(UniformRandomProvider rng) {
        return RandomSources.sampleIndex(cumulative, rng);
    }

    /**
     * @param model model index
     * @return prior probability, 0 for an index out of range
     */
    public double pmf(int model) {
        if (model < 0 || model >= probabilities.length) {
            return 0.0;
        }
        return probabilities[model];
    }

    public int size() {
        return probabilities.length;
    }

    @Override
    public String toString() {
        return "ModelPrior" + Arrays.toString(probabilities);
    }
}
