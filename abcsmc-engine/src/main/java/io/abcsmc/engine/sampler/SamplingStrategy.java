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

import io.abcsmc.model.Sample;

/// Execution strategy behind a [Sampler].
///
/// A strategy decides how many propose/evaluate cycles run, in what order and
/// with what concurrency. It must return a sample that either holds exactly
/// `task.n()` accepted evaluations or is marked degraded. Weight
/// normalization and output checks are applied afterwards by the
/// [SampleValidator], uniformly for every strategy.
///
/// | Strategy | Scheduling |
/// |----------|------------|
/// | [SingleCoreStrategy] | sequential loop on the calling thread |
/// | [MappingStrategy] | n independent "until accepted" jobs on a pool |
/// | [ConcurrentFutureStrategy] | speculative batches, results in submission order |
public interface SamplingStrategy {

    /// @param task the sampling request
    /// @return the raw, unnormalized sample
    Sample sample(SamplingTask task);

    /// @return a short name for logs
    default String name() {
        return getClass().getSimpleName();
    }
}
