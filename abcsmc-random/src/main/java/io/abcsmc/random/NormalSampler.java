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

import io.abcsmc.model.scalar.NormalScalarModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

/// Sampler for normal distributions, bound at construction.
public final class NormalSampler implements ScalarSampler {

    private final double mean;
    private final double stdDev;

    public NormalSampler(NormalScalarModel model) {
        this.mean = model.getMean();
        this.stdDev = model.getStdDev();
    }

    @Override
    public double sample(UniformRandomProvider rng) {
        return mean + stdDev * ZigguratSampler.NormalizedGaussian.of(rng).sample();
    }
}
