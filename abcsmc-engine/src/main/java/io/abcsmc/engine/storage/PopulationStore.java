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
import org.apache.commons.rng.UniformRandomProvider;

import java.util.List;

/// Records the generations of one run and serves them back to the engine.
///
/// The engine is the only writer. It reads model probabilities and weighted
/// particles of generation `t-1` while building generation `t`.
///
/// ```
///   storeInitialData ──► appendPopulation(0) ──► appendPopulation(1) ──► ... ──► done
///                               │                       ▲
///                               └── getModelProbabilities(0), weightedParticles(0, m)
/// ```
public interface PopulationStore {

    /// @return number of candidate models this store records
    int getNrModels();

    /// Records run metadata. Called once per new run.
    ///
    /// @param initialData the metadata
    void storeInitialData(InitialData initialData);

    /// @return the recorded metadata, null before [#storeInitialData]
    InitialData getInitialData();

    /// Stores the population of generation `t`.
    ///
    /// @param t generation index, one past [#maxT()]
    /// @param epsilon acceptance threshold of the generation
    /// @param particles accepted particles with final weights
    /// @param nrSimulations simulations spent on the generation
    /// @return true if the stored population is non-empty
    /// @throws IllegalArgumentException if `t` is not the next generation index
    boolean appendPopulation(int t, double epsilon, List<Particle> particles, long nrSimulations);

    /// @param t generation index
    /// @return probability per model index
    /// @throws IllegalArgumentException if generation `t` is not stored
    double[] getModelProbabilities(int t);

    /// Draws a model index proportionally to the model probabilities of generation `t`.
    ///
    /// @param t generation index
    /// @param rng random source
    /// @return the drawn model index
    int sampleFromModels(int t, UniformRandomProvider rng);

    /// @param t generation index
    /// @param model model index
    /// @return that model's parameters with weights normalized within the model
    WeightedParameters weightedParticles(int t, int model);

    /// @param t generation index
    /// @return number of models with non-zero probability at generation `t`
    int nrModelsAlive(int t);

    /// @return number of models alive in the latest generation, 0 if none is stored
    int nrModelsAlive();

    /// @return the latest stored generation index, -1 if none
    int maxT();

    /// @param t generation index
    /// @return the stored population
    Population getPopulation(int t);

    /// @param t generation index
    /// @return the accepted distances of generation `t` with their weights
    WeightedDistances getWeightedDistances(int t);

    /// @return simulations spent across all stored generations
    long totalNrSimulations();

    /// Marks the run as finished.
    void done();

    boolean isDone();
}
