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
import java.util.Collections;
import java.util.List;

/**
 * The accepted, weighted particle set of one generation.
 *
 * <pre>{@code
 *  accepted particles ──► drop invalid ──► drop weight == 0 ──► stored particles
 *          │                                                        │
 *          └── nrAccepted (reporting denominator)                   └── modelProbabilities
 * }</pre>
 *
 * <p>Model probabilities are the summed weights per model over the stored
 * particles, normalized over all {@code nrModels} models; an extinct model has
 * probability 0. Immutable once created.
 */
public final class Population {

    private final int t;
    private final double epsilon;
    private final int nrModels;
    private final int nrAccepted;
    private final List<Particle> particles;
    private final double[] modelProbabilities;

    private Population(int t, double epsilon, int nrModels, int nrAccepted, List<Particle> particles) {
        this.t = t;
        this.epsilon = epsilon;
        this.nrModels = nrModels;
        this.nrAccepted = nrAccepted;
        this.particles = Collections.unmodifiableList(particles);
        this.modelProbabilities = computeModelProbabilities(nrModels, particles);
    }

    /**
     * Builds a population from accepted particles.
     *
     * @param t generation index
     * @param epsilon acceptance threshold of the generation
     * @param nrModels total number of candidate models
     * @param accepted accepted particles, weights already computed
     * @return the population
     * @throws IllegalArgumentException if a particle's model index is out of range
     */
    public static Population of(int t, double epsilon, int nrModels, List<Particle> accepted) {
        if (t < 0) {
            throw new IllegalArgumentException("Generation index must be >= 0, got: " + t);
        }
        if (nrModels < 1) {
            throw new IllegalArgumentException("Need at least one model, got: " + nrModels);
        }
        List<Particle> stored = new ArrayList<>(accepted.size());
        int valid = 0;
        for (Particle particle : accepted) {
            if (particle.getModelIndex() >= nrModels) {
                throw new IllegalArgumentException(
                    "Particle model index " + particle.getModelIndex() + " >= nrModels " + nrModels);
            }
            if (!particle.isValid()) {
                continue;
            }
            valid++;
            if (particle.getWeight() > 0.0) {
                stored.add(particle);
            }
        }
        return new Population(t, epsilon, nrModels, valid, stored);
    }

    private static double[] computeModelProbabilities(int nrModels, List<Particle> particles) {
        double[] probabilities = new double[nrModels];
        double total = 0.0;
        for (Particle particle : particles) {
            probabilities[particle.getModelIndex()] += particle.getWeight();
            total += particle.getWeight();
        }
        if (total > 0.0) {
            for (int m = 0; m < nrModels; m++) {
                probabilities[m] /= total;
            }
        }
        return probabilities;
    }

    public int getT() {
        return t;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public int getNrModels() {
        return nrModels;
    }

    /**
     * @return number of valid accepted particles, zero-weight ones included
     */
    public int getNrAccepted() {
        return nrAccepted;
    }

    public List<Particle> getParticles() {
        return particles;
    }

    public int size() {
        return particles.size();
    }

    public boolean isEmpty() {
        return particles.isEmpty();
    }

    /**
     * @return probability per model index; all zero for an empty population
     */
    public double[] getModelProbabilities() {
        return modelProbabilities.clone();
    }

    public double getModelProbability(int model) {
        return modelProbabilities[model];
    }

    public int nrModelsAlive() {
        int alive = 0;
        for (double p : modelProbabilities) {
            if (p > 0.0) {
                alive++;
            }
        }
        return alive;
    }

    /**
     * @param model model index
     * @return parameters of that model with weights normalized within the model,
     *         empty if the model has no particles
     */
    public WeightedParameters weightedParameters(int model) {
        List<Parameter> parameters = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (Particle particle : particles) {
            if (particle.getModelIndex() == model) {
                parameters.add(particle.getParameter());
                weights.add(particle.getWeight());
            }
        }
        if (parameters.isEmpty()) {
            return WeightedParameters.empty();
        }
        double[] raw = new double[weights.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = weights.get(i);
        }
        return WeightedParameters.normalized(parameters, raw);
    }

    public WeightedDistances weightedDistances() {
        return WeightedDistances.of(particles);
    }

    @Override
    public String toString() {
        return "Population{t=" + t + ", ε=" + epsilon + ", particles=" + particles.size() +
            ", accepted=" + nrAccepted + '}';
    }
}
