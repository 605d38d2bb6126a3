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

import java.util.Map;

/**
 * Outcome of one simulation of a model.
 *
 * @param summaryStatistics summary statistics of the simulated data
 * @param distance distance to the observed data, NaN if not computed
 * @param accepted whether the distance is within the threshold
 */
public record ModelResult(Map<String, Double> summaryStatistics, double distance, boolean accepted) {

    public ModelResult {
        summaryStatistics = Map.copyOf(summaryStatistics);
    }

    public static ModelResult ofSummaryStatistics(Map<String, Double> summaryStatistics) {
        return new ModelResult(summaryStatistics, Double.NaN, false);
    }
}
