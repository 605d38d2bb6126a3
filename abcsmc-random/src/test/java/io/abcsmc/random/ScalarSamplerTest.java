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
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ScalarSamplerTest {

    private static final int N = 50_000;

    private static SummaryStatistics draw(ScalarModel model, long seed) {
        ScalarSampler sampler = ScalarSamplerFactory.forModel(model);
        UniformRandomProvider rng = RandomSources.create(seed);
        SummaryStatistics stats = new SummaryStatistics();
        for (int i = 0; i < N; i++) {
            stats.addValue(sampler.sample(rng));
        }
        return stats;
    }

    @Test
    void normalMomentsMatchModel() {
        SummaryStatistics stats = draw(new NormalScalarModel(3.0, 2.0), 42L);
        assertEquals(3.0, stats.getMean(), 0.05);
        assertEquals(2.0, stats.getStandardDeviation(), 0.05);
    }

    @Test
    void uniformStaysInBounds() {
        SummaryStatistics stats = draw(new UniformScalarModel(-2.0, 6.0), 7L);
        assertTrue(stats.getMin() >= -2.0);
        assertTrue(stats.getMax() < 6.0);
        assertEquals(2.0, stats.getMean(), 0.05);
    }

    @Test
    void logNormalIsPositiveWithExpectedMedianScale() {
        SummaryStatistics stats = draw(new LogNormalScalarModel(0.0, 0.5), 11L);
        assertTrue(stats.getMin() > 0.0);
        assertEquals(Math.exp(0.125), stats.getMean(), 0.02);
    }

    @Test
    void sameSeedGivesSameSequence() {
        ScalarSampler sampler = ScalarSamplerFactory.forModel(NormalScalarModel.standardNormal());
        UniformRandomProvider a = RandomSources.create(5L);
        UniformRandomProvider b = RandomSources.create(5L);
        for (int i = 0; i < 100; i++) {
            assertEquals(sampler.sample(a), sampler.sample(b));
        }
    }

    @Test
    void unsupportedModelIsRejected() {
        ScalarModel custom = new ScalarModel() {
            @Override
            public String getModelType() {
                return "custom";
            }

            @Override
            public double pdf(double x) {
                return 0;
            }
        };
        assertThrows(IllegalArgumentException.class, () -> ScalarSamplerFactory.forModel(custom));
    }
}
