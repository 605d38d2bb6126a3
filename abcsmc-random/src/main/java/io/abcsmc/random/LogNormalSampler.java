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
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

/// Sampler for log-normal distributions: exp of a bound normal draw.
public final class LogNormalSampler implements ScalarSampler {

    private final double logMean;
    private final double logStdDev;

    public LogNormalSampler(LogNormalScalarModel model) {
        this.logMean = model.getLogMean();
        this.logStdDev = model.getLogStdDev();
    }

    @Override
    public double sample(UniformRandomProvider rng) {
        return Math.exp(logMean + logStdDev * ZigguratSampler.NormalizedGaussian.of(rng).sample());
    }
}
