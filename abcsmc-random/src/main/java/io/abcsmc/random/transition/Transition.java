package io.abcsmc.random.transition;

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
import io.abcsmc.model.WeightedParameters;
import org.apache.commons.rng.UniformRandomProvider;

/// Perturbation kernel for the parameters of one model.
///
/// ## Lifecycle
///
/// ```
///   generation t-1 population ──► weightedParameters(m) ──► fit ──► Fitted
///                                                                    │
///                        generation t proposals ◄── rvs(rng) ◄──────┤
///                        importance weights    ◄── pdf(θ)   ◄───────┘
/// ```
///
/// A kernel is refit at the start of every generation, and each fit produces a
/// new immutable [Fitted] object. Fitted kernels are shared by all sampling
/// workers of the generation, so they must be safe for concurrent reads.
public interface Transition {

    /// Fits the kernel to a weighted sample.
    ///
    /// @param sample non-empty weighted parameters of one model
    /// @return the fitted kernel
    /// @throws IllegalArgumentException if the sample is empty
    Fitted fit(WeightedParameters sample);

    /// A kernel fitted to one generation.
    interface Fitted {

        /// @param rng random source owned by the caller
        /// @return a perturbed parameter
        Parameter rvs(UniformRandomProvider rng);

        /// @param parameter the parameter to evaluate
        /// @return the kernel density at that parameter, ≥ 0
        double pdf(Parameter parameter);
    }
}
