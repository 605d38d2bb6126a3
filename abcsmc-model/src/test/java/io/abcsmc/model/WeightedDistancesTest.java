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

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class WeightedDistancesTest {

    @Test
    void weightedMedianFollowsWeights() {
        WeightedDistances distances = new WeightedDistances(
            List.of(5.0, 1.0, 3.0), List.of(0.1, 0.1, 0.8));
        assertEquals(3.0, distances.weightedMedian(), 0.0);
        assertEquals(1.0, distances.weightedQuantile(0.05), 0.0);
        assertEquals(5.0, distances.weightedQuantile(1.0), 0.0);
    }

    @Test
    void splitsParticleWeightAcrossItsDistances() {
        Particle particle = new Particle(0, Parameter.of("x", 1.0), 0.6, List.of(1.0, 2.0), List.of());
        WeightedDistances distances = WeightedDistances.of(List.of(particle));
        assertEquals(List.of(0.3, 0.3), distances.weights());
    }

    @Test
    void emptyDistancesHaveNoQuantile() {
        WeightedDistances distances = new WeightedDistances(List.of(), List.of());
        assertThrows(IllegalStateException.class, distances::weightedMedian);
        assertThrows(IllegalArgumentException.class, () -> distances.weightedQuantile(1.5));
    }
}
