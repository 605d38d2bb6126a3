package io.abcsmc.engine.storage;

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

import io.abcsmc.model.Particle;
import io.abcsmc.model.Population;
import io.abcsmc.model.WeightedDistances;
import io.abcsmc.model.WeightedParameters;
import io.abcsmc.random.RandomSources;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link PopulationStore} that keeps every generation in memory.
 *
 * <p>All methods are synchronized; a single writer with concurrent readers is
 * safe.
 */
public class InMemoryHistory implements PopulationStore {

    private static final Logger logger = LogManager.getLogger(InMemoryHistory.class);

    private final int nrModels;
    private final List<Population> populations = new ArrayList<>();
    private final List<Long> simulations = new ArrayList<>();
    private InitialData initialData;
    private boolean done;

    /**
     * @param nrModels number of candidate models
     * @throws IllegalArgumentException if nrModels is below 1
     */
    public InMemoryHistory(int nrModels) {
        if (nrModels < 1) {
            throw new IllegalArgumentException("Need at least one model, got: " + nrModels);
        }
        this.nrModels = nrModels;
    }

    @Override
    public int getNrModels() {
        return nrModels;
    }

    @Override
    public synchronized void storeInitialData(InitialData initialData) {
        if (initialData.modelNames().size() != nrModels) {
            throw new IllegalArgumentException("Got " + initialData.modelNames().size()
                + " model names for a store of " + nrModels + " models");
        }
        this.initialData = initialData;
    }

    @Override
    public synchronized InitialData getInitialData() {
        return initialData;
    }

    @Override
    public synchronized boolean appendPopulation(int t, double epsilon, List<Particle> particles,
                                                 long nrSimulations) {
        if (t != populations.size()) {
            throw new IllegalArgumentException("Expected generation " + populations.size() + ", got " + t);
        }
        Population population = Population.of(t, epsilon, nrModels, particles);
        populations.add(population);
        simulations.add(nrSimulations);
        logger.debug("Stored {}", population);
        return !population.isEmpty();
    }

    @Override
    public synchronized double[] getModelProbabilities(int t) {
        return getPopulation(t).getModelProbabilities();
    }

    @Override
    public int sampleFromModels(int t, UniformRandomProvider rng) {
        double[] probabilities = getModelProbabilities(t);
        return RandomSources.sampleIndex(RandomSources.cumulative(probabilities), rng);
    }

    @Override
    public synchronized WeightedParameters weightedParticles(int t, int model) {
        return getPopulation(t).weightedParameters(model);
    }

    @Override
    public synchronized int nrModelsAlive(int t) {
        return getPopulation(t).nrModelsAlive();
    }

    @Override
    public synchronized int nrModelsAlive() {
        return populations.isEmpty() ? 0 : nrModelsAlive(maxT());
    }

    @Override
    public synchronized int maxT() {
        return populations.size() - 1;
    }

    @Override
    public synchronized Population getPopulation(int t) {
        if (t < 0 || t >= populations.size()) {
            throw new IllegalArgumentException("Generation " + t + " is not stored, max t is " + maxT());
        }
        return populations.get(t);
    }

    @Override
    public synchronized WeightedDistances getWeightedDistances(int t) {
        return getPopulation(t).weightedDistances();
    }

    @Override
    public synchronized long totalNrSimulations() {
        long total = 0;
        for (long count : simulations) {
            total += count;
        }
        return total;
    }

    @Override
    public synchronized void done() {
        done = true;
    }

    @Override
    public synchronized boolean isDone() {
        return done;
    }
}
