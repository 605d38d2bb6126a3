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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One (model, parameter) sample together with its evaluation outcome and
 * importance weight.
 *
 * <h2>Validity</h2>
 *
 * <p>A particle is <em>valid</em> only if at least one of its simulations was
 * accepted, i.e. its distance list is non-empty. Invalid particles are never
 * stored in a {@link Population}.
 *
 * <h2>Preliminary particles</h2>
 *
 * <p>Look-ahead sampling strategies may create a particle for a proposal that
 * has not been evaluated yet. Such a particle is flagged {@link #isPreliminary()}
 * and must not survive the end of sampling.
 *
 * <p>Instances are immutable; {@link #withWeight(double)} returns a copy.
 */
public final class Particle {

    private final int modelIndex;
    private final Parameter parameter;
    private final double weight;
    private final List<Double> distances;
    private final List<Map<String, Double>> summaryStatistics;
    private final boolean preliminary;

    /**
     * Creates an evaluated particle.
     *
     * @param modelIndex index of the model that produced this particle
     * @param parameter the proposed parameter
     * @param weight importance weight; must be finite and non-negative
     * @param distances accepted distances, one per accepted simulation
     * @param summaryStatistics summary statistics of the accepted simulations
     * @throws IllegalArgumentException if weight is negative or not finite,
     *         or the two lists differ in length
     */
    public Particle(int modelIndex, Parameter parameter, double weight,
                    List<Double> distances, List<Map<String, Double>> summaryStatistics) {
        this(modelIndex, parameter, weight, distances, summaryStatistics, false);
    }

    private Particle(int modelIndex, Parameter parameter, double weight,
                     List<Double> distances, List<Map<String, Double>> summaryStatistics,
                     boolean preliminary) {
        if (modelIndex < 0) {
            throw new IllegalArgumentException("Model index must be non-negative, got: " + modelIndex);
        }
        if (!(weight >= 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Weight must be finite and >= 0, got: " + weight);
        }
        this.modelIndex = modelIndex;
        this.parameter = Objects.requireNonNull(parameter, "parameter");
        this.weight = weight;
        this.distances = List.copyOf(distances);
        this.summaryStatistics = List.copyOf(summaryStatistics);
        this.preliminary = preliminary;
    }

    /**
     * Creates a placeholder for a proposal that has not been evaluated yet.
     *
     * @param modelIndex proposed model
     * @param parameter proposed parameter
     * @return a preliminary particle with weight 0 and no distances
     */
    public static Particle preliminary(int modelIndex, Parameter parameter) {
        return new Particle(modelIndex, parameter, 0.0, List.of(), List.of(), true);
    }

    /**
     * Creates a particle carrying only summary statistics, as produced when
     * sampling from the prior to calibrate distances and thresholds.
     *
     * @param modelIndex model index
     * @param parameter parameter
     * @param summaryStatistics the simulated summary statistics
     * @return a particle with weight 1 and no distances
     */
    public static Particle ofSummaryStatistics(int modelIndex, Parameter parameter,
                                               Map<String, Double> summaryStatistics) {
        return new Particle(modelIndex, parameter, 1.0, List.of(), List.of(summaryStatistics));
    }

    public int getModelIndex() {
        return modelIndex;
    }

    public Parameter getParameter() {
        return parameter;
    }

    public double getWeight() {
        return weight;
    }

    public List<Double> getDistances() {
        return distances;
    }

    public List<Map<String, Double>> getSummaryStatistics() {
        return summaryStatistics;
    }

    public boolean isPreliminary() {
        return preliminary;
    }

    /**
     * @return true if at least one simulation for this particle was accepted
     */
    public boolean isValid() {
        return !distances.isEmpty();
    }

    /**
     * @param newWeight the replacement weight
     * @return a copy of this particle with the given weight
     */
    public Particle withWeight(double newWeight) {
        return new Particle(modelIndex, parameter, newWeight, distances, summaryStatistics, preliminary);
    }

    @Override
    public String toString() {
        return "Particle{m=" + modelIndex +
            ", θ=" + parameter +
            ", w=" + weight +
            ", distances=" + distances +
            (preliminary ? ", preliminary" : "") +
            '}';
    }
}
