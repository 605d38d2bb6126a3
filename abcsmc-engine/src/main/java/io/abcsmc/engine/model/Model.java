package io.abcsmc.engine.model;

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

import io.abcsmc.model.Parameter;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.function.UnaryOperator;

/// One candidate model.
///
/// A model exposes two capabilities to the engine:
///
/// | Capability | Used for |
/// |------------|----------|
/// | [#summaryStatistics] | calibrating distances and thresholds on the prior |
/// | [#accept] | every simulation during a generation |
///
/// Subclasses implement [#sample], the raw simulation. The default
/// [#accept] simulates once, maps the output to summary statistics, and
/// accepts when the distance to the observed data is at most `epsilon`.
/// Subclasses may override it, for example to stop a simulation early once it
/// is known to exceed the threshold.
///
/// Models are called concurrently by parallel sampling strategies; the provider
/// passed in is owned by the calling worker.
public abstract class Model {

    private final String name;

    protected Model(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    /// Simulates the model once.
    ///
    /// @param parameter the parameter to simulate with
    /// @param rng random source for the simulation
    /// @return the raw simulated output as named values
    public abstract Map<String, Double> sample(Parameter parameter, UniformRandomProvider rng);

    /// @param parameter the parameter to simulate with
    /// @param transform maps raw output to summary statistics
    /// @param rng random source for the simulation
    /// @return a result carrying summary statistics only
    public ModelResult summaryStatistics(Parameter parameter, UnaryOperator<Map<String, Double>> transform,
                                         UniformRandomProvider rng) {
        return ModelResult.ofSummaryStatistics(transform.apply(sample(parameter, rng)));
    }

    /// @param parameter the parameter to simulate with
    /// @param transform maps raw output to summary statistics
    /// @param distanceToObserved distance of summary statistics to the observed ones
    /// @param epsilon acceptance threshold
    /// @param rng random source for the simulation
    /// @return the simulated statistics, their distance, and whether it is within epsilon
    public ModelResult accept(Parameter parameter, UnaryOperator<Map<String, Double>> transform,
                              ToDoubleFunction<Map<String, Double>> distanceToObserved, double epsilon,
                              UniformRandomProvider rng) {
        Map<String, Double> stats = summaryStatistics(parameter, transform, rng).summaryStatistics();
        double distance = distanceToObserved.applyAsDouble(stats);
        return new ModelResult(stats, distance, distance <= epsilon);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
