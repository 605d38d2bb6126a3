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

import org.apache.commons.rng.UniformRandomProvider;

/// Sampler that produces variates from a bound ScalarModel distribution.
///
/// ```text
///   Construction (once)                    Sampling (per value)
///  ┌─────────────────┐                   ┌──────────────────────┐
///  │   ScalarModel   │                   │ UniformRandomProvider│
///  │ mean, stdDev,   │ ──► Sampler ◄──── │ (caller owned)       │
///  │ bounds, type    │     (bound)       └──────────┬───────────┘
///  └─────────────────┘                              ▼
///                                           double value (variate)
/// ```
///
/// Samplers are stateless and may be shared between threads as long as each
/// thread passes its own provider.
///
/// @see ScalarSamplerFactory
@FunctionalInterface
public interface ScalarSampler {

    /// @param rng the random source for this draw
    /// @return one variate
    double sample(UniformRandomProvider rng);
}
