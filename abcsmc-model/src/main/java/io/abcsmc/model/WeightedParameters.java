package io.abcsmc.model;

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

import java.util.Arrays;
import java.util.List;

/**
 * Parameters of one model in one generation together with their weights,
 * normalized to sum to one within the model. This is the input to
 * perturbation kernel fitting.
 *
 * @param names parameter names in a fixed order
 * @param parameters the particle parameters
 * @param weights normalized weights, parallel to parameters
 */
public record WeightedParameters(List<String> names, List<Parameter> parameters, double[] weights) {

    public WeightedParameters {
        names = List.copyOf(names);
        parameters = List.copyOf(parameters);
        weights = weights.clone();
        if (parameters.size() != weights.length) {
            throw new IllegalArgumentException(
                "Got " + parameters.size() + " parameters but " + weights.length + " weights");
        }
    }

    /**
     * Builds a view from unnormalized weights.
     *
     * @param parameters the parameters
     * @param rawWeights non-negative weights with a positive sum
     * @return a view with weights scaled to sum to one
     */
    public static WeightedParameters normalized(List<Parameter> parameters, double[] rawWeights) {
        if (parameters.isEmpty()) {
            return empty();
        }
        double total = Arrays.stream(rawWeights).sum();
        if (!(total > 0.0)) {
            throw new IllegalArgumentException("Weights must have a positive sum, got " + total);
        }
        double[] weights = new double[rawWeights.length];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = rawWeights[i] / total;
        }
        return new WeightedParameters(parameters.get(0).names(), parameters, weights);
    }

    public static WeightedParameters empty() {
        return new WeightedParameters(List.of(), List.of(), new double[0]);
    }

    public int size() {
        return parameters.size();
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    /**
     * @return row-major matrix of parameter values in {@link #names()} order
     */
    public double[][] toMatrix() {
        double[][] matrix = new double[parameters.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = parameters.get(i).toArray(names);
        }
        return matrix;
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }
}
