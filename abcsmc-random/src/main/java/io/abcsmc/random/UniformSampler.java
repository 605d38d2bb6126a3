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

import io.abcsmc.model.scalar.UniformScalarModel;
import org.apache.commons.rng.UniformRandomProvider;

/// Sampler for uniform distributions, bound at construction.
///
/// Maps a uniform draw in [0, 1) linearly onto [lower, upper).
public final class UniformSampler implements ScalarSampler {

    private final double lower;
    private final double range;

    public UniformSampler(UniformScalarModel model) {
        this.lower = model.getLower();
        this.range = model.getUpper() - model.getLower();
    }

    @Override
    public double sample(UniformRandomProvider rng) {
        return lower + rng.nextDouble() * range;
    }
}
