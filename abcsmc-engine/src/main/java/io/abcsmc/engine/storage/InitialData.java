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

import io.abcsmc.model.Parameter;

import java.util.List;
import java.util.Map;

/**
 * Run metadata recorded once, before the first generation.
 *
 * @param groundTruthModel index of the model that generated synthetic data, -1 if unknown
 * @param groundTruthParameter parameter that generated synthetic data, null if unknown
 * @param observedSummaryStatistics the observed data
 * @param metadata free-form run options, recorded only
 * @param modelNames model names in index order
 * @param distanceFunctionJson provenance of the distance function
 * @param epsilonJson provenance of the epsilon schedule
 */
public record InitialData(int groundTruthModel,
                          Parameter groundTruthParameter,
                          Map<String, Double> observedSummaryStatistics,
                          Map<String, String> metadata,
                          List<String> modelNames,
                          String distanceFunctionJson,
                          String epsilonJson) {

    public InitialData {
        observedSummaryStatistics = Map.copyOf(observedSummaryStatistics);
        metadata = Map.copyOf(metadata);
        modelNames = List.copyOf(modelNames);
    }
}
