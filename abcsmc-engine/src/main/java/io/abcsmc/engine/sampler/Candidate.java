package io.abcsmc.engine.sampler;

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

import java.util.Objects;

/**
 * A proposed (model, parameter) pair awaiting evaluation.
 *
 * @param modelIndex proposed model
 * @param parameter proposed parameter
 */
public record Candidate(int modelIndex, Parameter parameter) {

    public Candidate {
        if (modelIndex < 0) {
            throw new IllegalArgumentException("Model index must be non-negative, got: " + modelIndex);
        }
        Objects.requireNonNull(parameter, "parameter");
    }
}
