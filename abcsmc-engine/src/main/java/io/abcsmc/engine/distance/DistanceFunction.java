package io.abcsmc.engine.distance;

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

/**
 * Distance between simulated and observed summary statistics.
 *
 * <p>A distance function may be adaptive: {@link #initialize(List)} is called
 * once with summary statistics simulated from the prior before the first
 * generation. After that it is only read, concurrently, by sampling workers.
 */
public interface DistanceFunction {

    /**
     * Calibrates the function on a prior sample. The default does nothing.
     *
     * @param sampleFromPrior summary statistics simulated from the prior
     */
    default void initialize(List<Map<String, Double>> sampleFromPrior) {
    }

    /**
     * @param simulated simulated summary statistics
     * @param observed observed summary statistics
     * @return a non-negative distance
     * @throws IllegalArgumentException if a statistic of the observed data is missing from the simulation
     */
    double distance(Map<String, Double> simulated, Map<String, Double> observed);

    /**
     * @return a JSON description stored with the run for provenance
     */
    String toJson();

    /**
     * @param simulated simulated summary statistics
     * @param observed observed summary statistics
     * @param key statistic name
     * @return absolute difference of the statistic
     */
    static double absoluteDifference(Map<String, Double> simulated, Map<String, Double> observed, String key) {
        Double value = simulated.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Simulated statistics lack '" + key + "', got: " + simulated.keySet());
        }
        return Math.abs(value - observed.get(key));
    }
}
