package io.abcsmc.model.scalar;

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

/// Description of a one-dimensional prior distribution over a single named
/// parameter.
///
/// ## Models vs Samplers
///
/// A ScalarModel is a pure data description. It holds the distribution
/// parameters and can evaluate its density, but it does not draw values.
/// Drawing is done by the `ScalarSampler` implementations in the random
/// module, each bound once to its model type.
///
/// ```
///   ScalarModel ──(ScalarSamplerFactory.forModel)──► ScalarSampler
///   (pdf)                                              (sample(rng))
/// ```
///
/// ## Implementations
///
/// | Model Type | Distribution | Parameters |
/// |------------|--------------|------------|
/// | [NormalScalarModel] | Normal N(μ, σ²) | mean, std_dev |
/// | [UniformScalarModel] | Uniform | lower, upper |
/// | [LogNormalScalarModel] | Log-normal | log_mean, log_std_dev |
public interface ScalarModel {

    /// Returns the model type identifier used as the JSON discriminator.
    ///
    /// @return the model type identifier (e.g. "normal", "uniform")
    String getModelType();

    /// Probability density at `x`.
    ///
    /// @param x the value at which to evaluate the density
    /// @return the density, zero outside the support
    double pdf(double x);
}
