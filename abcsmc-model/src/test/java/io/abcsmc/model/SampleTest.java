package io.abcsmc.model;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SampleTest {

    private static Evaluation accepted(int model, double weight, long simulations) {
        Particle particle = new Particle(model, Parameter.of("x", weight), weight,
            List.of(0.1), List.of(Map.of("s", 1.0)));
        return Evaluation.of(particle, simulations);
    }

    @Test
    void normalizesAcceptedWeightsOnce() {
        Sample sample = new SampleFactory().newSample();
        sample.append(accepted(0, 1.0, 2), true);
        sample.append(accepted(1, 3.0, 5), true);
        sample.append(Evaluation.exhausted(0, Parameter.of("x", 9.0), 4), false);

        sample.normalizeWeights();
        sample.normalizeWeights();

        List<Particle> particles = sample.getAcceptedParticles();
        assertEquals(0.25, particles.get(0).getWeight(), 1e-12);
        assertEquals(0.75, particles.get(1).getWeight(), 1e-12);
        assertEquals(3, sample.getNrEvaluations());
        assertEquals(11, sample.getNrSimulations());
        assertTrue(sample.getRejected().isEmpty());
        assertThrows(IllegalStateException.class, () -> sample.append(accepted(0, 1.0, 1), true));
    }

    @Test
    void zeroTotalWeightLeavesWeightsAtZero() {
        Sample sample = new SampleFactory().newSample();
        sample.append(accepted(0, 0.0, 1), true);
        sample.append(accepted(0, 0.0, 1), true);
        sample.normalizeWeights();
        assertTrue(sample.getAcceptedParticles().stream().allMatch(p -> p.getWeight() == 0.0));
    }

    @Test
    void recordsRejectedOnlyWhenAsked() {
        Sample sample = new SampleFactory(true).newSample();
        sample.append(Evaluation.exhausted(0, Parameter.of("x", 1.0), 7), false);
        sample.recordFailedEvaluation();
        assertEquals(1, sample.getRejected().size());
        assertTrue(sample.getRejected().get(0).isExhausted());
        assertEquals(2, sample.getNrEvaluations());
        assertEquals(1, sample.getNrFailedEvaluations());
    }

    @Test
    void degradedSampleIsNotOk() {
        Sample sample = new SampleFactory().newSample();
        assertTrue(sample.isOk());
        sample.markDegraded("budget exhausted");
        assertFalse(sample.isOk());
        assertEquals("budget exhausted", sample.getDegradedReason());
    }

    @Test
    void particleRejectsNegativeWeight() {
        assertThrows(IllegalArgumentException.class,
            () -> new Particle(0, Parameter.empty(), -0.1, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new Particle(0, Parameter.empty(), Double.NaN, List.of(), List.of()));
        assertTrue(Particle.preliminary(0, Parameter.empty()).isPreliminary());
    }
}
