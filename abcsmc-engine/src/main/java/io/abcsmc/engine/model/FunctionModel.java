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

/**
 * A {@link Model} backed by a simulator function.
 *
 * <pre>{@code
 * Model model = FunctionModel.of("gaussian", (theta, rng) ->
 *     Map.of("y", theta.get("mu") + ZigguratSampler.NormalizedGaussian.of(rng).sample()));
 * }</pre>
 */
public final class FunctionModel extends Model {

    /** Raw simulation of a parameter. */
    @FunctionalInterface
    public interface Simulator {
        Map<String, Double> simulate(Parameter parameter, UniformRandomProvider rng);
    }

    private final Simulator simulator;

    private FunctionModel(String name, Simulator simulator) {
        super(name);
        this.simulator = Objects.requireNonNull(simulator, "simulator");
    }

    public static FunctionModel of(String name, Simulator simulator) {
        return new FunctionModel(name, simulator);
    }

    @Override
    public Map<String, Double> sample(Parameter parameter, UniformRandomProvider rng) {
        return simulator.simulate(parameter, rng);
    }
}
