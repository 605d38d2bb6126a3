package io.abcsmc.random;

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

import io.abcsmc.model.scalar.LogNormalScalarModel;
import io.abcsmc.model.scalar.NormalScalarModel;
import io.abcsmc.model.scalar.ScalarModel;
import io.abcsmc.model.scalar.UniformScalarModel;

/// Factory for creating bound [ScalarSampler] instances from [ScalarModel] types.
///
/// The type dispatch happens once here, not on every sample call.
///
/// ```java
/// ScalarSampler sampler = ScalarSamplerFactory.forModel(new NormalScalarModel(0.0, 1.0));
/// double value = sampler.sample(rng);
/// ```
public final class ScalarSamplerFactory {

    private ScalarSamplerFactory() {
    }

    /// @param model the scalar model
    /// @return a sampler bound to the model's parameters
    /// @throws IllegalArgumentException if the model type is not supported
    public static ScalarSampler forModel(ScalarModel model) {
        if (model instanceof NormalScalarModel) {
            return new NormalSampler((NormalScalarModel) model);
        } else if (model instanceof UniformScalarModel) {
            return new UniformSampler((UniformScalarModel) model);
        } else if (model instanceof LogNormalScalarModel) {
            return new LogNormalSampler((LogNormalScalarModel) model);
        }
        throw new IllegalArgumentException(
            "No sampler for model type: " + model.getClass().getName());
    }
}
