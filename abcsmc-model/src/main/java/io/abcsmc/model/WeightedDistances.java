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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Accepted distances of one generation with the weight each carries. A
 * particle with k accepted distances contributes each of them with weight
 * {@code particleWeight / k}.
 *
 * @param distances the distances
 * @param weights the weights, parallel to distances
 */
public record WeightedDistances(List<Double> distances, List<Double> weights) {

    public WeightedDistances {
        distances = List.copyOf(distances);
        weights = List.copyOf(weights);
        if (distances.size() != weights.size()) {
            throw new IllegalArgumentException(
                "Got " + distances.size() + " distances but " + weights.size() + " weights");
        }
    }

    public static WeightedDistances of(List<Particle> particles) {
        List<Double> distances = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (Particle particle : particles) {
            List<Double> particleDistances = particle.getDistances();
            for (Double distance : particleDistances) {
                distances.add(distance);
                weights.add(particle.getWeight() / particleDistances.size());
            }
        }
        return new WeightedDistances(distances, weights);
    }

    public boolean isEmpty() {
        return distances.isEmpty();
    }

    public int size() {
        return distances.size();
    }

    /**
     * Smallest distance whose cumulative normalized weight reaches {@code q}.
     *
     * @param q quantile in [0, 1]
     * @return the weighted quantile
     * @throws IllegalStateException if there are no distances or the weights sum to zero
     */
    public double weightedQuantile(double q) {
        if (!(q >= 0.0 && q <= 1.0)) {
            throw new IllegalArgumentException("Quantile must be in [0, 1], got: " + q);
        }
        if (distances.isEmpty()) {
            throw new IllegalStateException("No distances to compute a quantile from");
        }
        List<Integer> order = new ArrayList<>(distances.size());
        double total = 0.0;
        for (int i = 0; i < distances.size(); i++) {
            order.add(i);
            total += weights.get(i);
        }
        if (!(total > 0.0)) {
            throw new IllegalStateException("Distance weights sum to " + total);
        }
        order.sort(Comparator.comparingDouble(distances::get));
        double cumulative = 0.0;
        for (int index : order) {
            cumulative += weights.get(index) / total;
            if (cumulative >= q - 1e-12) {
                return distances.get(index);
            }
        }
        return distances.get(order.get(order.size() - 1));
    }

    public double weightedMedian() {
        return weightedQuantile(0.5);
    }
}
