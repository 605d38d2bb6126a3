package io.abcsmc.engine.epsilon;

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

import io.abcsmc.engine.storage.PopulationStore;

import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Acceptance threshold schedule. Called once per generation by the engine,
 * on the engine thread, before sampling starts.
 */
public interface Epsilon {

    /**
     * Calibrates the schedule on a prior sample. The default does nothing.
     *
     * @param sampleFromPrior summary statistics simulated from the prior
     * @param distanceToObserved distance of summary statistics to the observed data
     */
    default void initialize(List<Map<String, Double>> sampleFromPrior,
                            ToDoubleFunction<Map<String, Double>> distanceToObserved) {
    }

    /**
     * @param t generation index
     * @param history generations stored so far, up to {@code t - 1}
     * @return the threshold for generation {@code t}
     */
    double value(int t, PopulationStore history);

    /**
     * @return a JSON description stored with the run for provenance
     */
    String toJson();
}
