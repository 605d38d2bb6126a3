package io.abcsmc.engine.epsilon;

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

import io.abcsmc.engine.storage.InMemoryHistory;
import io.abcsmc.model.Parameter;
import io.abcsmc.model.Particle;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EpsilonTest {

    private static Particle particle(double distance, double weight) {
        return new Particle(0, Parameter.of("x", distance), weight, List.of(distance), List.of(Map.of("y", distance)));
    }

    @Test
    void constantEpsilonIgnoresTheGeneration() {
        ConstantEpsilon epsilon = new ConstantEpsilon(0.25);
        assertEquals(0.25, epsilon.value(0, new InMemoryHistory(1)));
        assertEquals(0.25, epsilon.value(7, new InMemoryHistory(1)));
        assertThrows(IllegalArgumentException.class, () -> new ConstantEpsilon(Double.NaN));
    }

    @Test
    void listEpsilonFollowsTheSchedule() {
        ListEpsilon epsilon = ListEpsilon.of(3.0, 2.0, 1.0);
        InMemoryHistory history = new InMemoryHistory(1);
        assertEquals(3.0, epsilon.value(0, history));
        assertEquals(1.0, epsilon.value(2, history));
        assertThrows(IllegalArgumentException.class, () -> epsilon.value(3, history));
        assertThat(epsilon.toJson()).contains("[3.0,2.0,1.0]");
    }

    @Test
    void medianEpsilonStartsFromThePriorSample() {
        MedianEpsilon epsilon = new MedianEpsilon();
        List<Map<String, Double>> prior = List.of(Map.of("y", 1.0), Map.of("y", 2.0), Map.of("y", 6.0));
        epsilon.initialize(prior, stats -> stats.get("y"));
        assertEquals(2.0, epsilon.value(0, new InMemoryHistory(1)), 1e-12);
    }

    @Test
    void medianEpsilonUsesWeightedMedianOfThePreviousGeneration() {
        MedianEpsilon epsilon = new MedianEpsilon(10.0, 0.5);
        InMemoryHistory history = new InMemoryHistory(1);
        assertEquals(10.0, epsilon.value(0, history));

        history.appendPopulation(0, 10.0, List.of(particle(1.0, 0.1), particle(4.0, 0.6), particle(8.0, 0.3)), 3);

        assertEquals(2.0, epsilon.value(1, history), 1e-12);
        // cached: a later generation does not change an earlier value
        history.appendPopulation(1, 2.0, List.of(particle(0.2, 1.0)), 1);
        assertEquals(2.0, epsilon.value(1, history), 1e-12);
        assertEquals(0.1, epsilon.value(2, history), 1e-12);
    }

    @Test
    void medianEpsilonInitializeStartsAFreshSchedule() {
        MedianEpsilon epsilon = new MedianEpsilon(10.0, 0.5);
        List<Map<String, Double>> prior = List.of(Map.of("y", 1.0));
        epsilon.initialize(prior, stats -> stats.get("y"));
        InMemoryHistory first = new InMemoryHistory(1);
        first.appendPopulation(0, 10.0, List.of(particle(1.0, 0.1), particle(4.0, 0.6), particle(8.0, 0.3)), 3);
        assertEquals(2.0, epsilon.value(1, first), 1e-12);

        epsilon.initialize(prior, stats -> stats.get("y"));
        InMemoryHistory second = new InMemoryHistory(1);
        second.appendPopulation(0, 10.0, List.of(particle(6.0, 1.0)), 1);

        assertEquals(10.0, epsilon.value(0, second));
        assertEquals(3.0, epsilon.value(1, second), 1e-12);
    }

    @Test
    void medianEpsilonNeedsAnInitialValue() {
        MedianEpsilon epsilon = new MedianEpsilon();
        assertThrows(IllegalStateException.class, () -> epsilon.value(0, new InMemoryHistory(1)));
        assertThrows(IllegalArgumentException.class, () -> epsilon.initialize(List.of(), stats -> 0.0));
        assertThrows(IllegalArgumentException.class, () -> new MedianEpsilon(1.0, 0.0));
    }
}
