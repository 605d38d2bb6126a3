package io.abcsmc.engine.storage;

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
import io.abcsmc.model.Particle;
import io.abcsmc.model.WeightedParameters;
import io.abcsmc.random.RandomSources;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class InMemoryHistoryTest {

    private static Particle particle(int model, double x, double weight) {
        return new Particle(model, Parameter.of("x", x), weight, List.of(0.1), List.of(Map.of("y", x)));
    }

    @Test
    void storesGenerationsInOrder() {
        InMemoryHistory history = new InMemoryHistory(2);
        assertEquals(-1, history.maxT());
        assertEquals(0, history.nrModelsAlive());

        assertTrue(history.appendPopulation(0, 1.0, List.of(particle(0, 0.1, 0.25), particle(1, 0.2, 0.75)), 40));
        assertTrue(history.appendPopulation(1, 0.5, List.of(particle(0, 0.3, 1.0)), 60));

        assertEquals(1, history.maxT());
        assertArrayEquals(new double[]{0.25, 0.75}, history.getModelProbabilities(0), 1e-12);
        assertEquals(2, history.nrModelsAlive(0));
        assertEquals(1, history.nrModelsAlive());
        assertEquals(100, history.totalNrSimulations());
        assertEquals(0.5, history.getPopulation(1).getEpsilon());
        assertThrows(IllegalArgumentException.class, () -> history.appendPopulation(3, 0.1, List.of(), 1));
        assertThrows(IllegalArgumentException.class, () -> history.getPopulation(2));
    }

    @Test
    void emptyOrZeroWeightPopulationReportsEmpty() {
        InMemoryHistory history = new InMemoryHistory(1);
        assertFalse(history.appendPopulation(0, 1.0, List.of(particle(0, 0.1, 0.0)), 5));
        assertEquals(1, history.getPopulation(0).getNrAccepted());
        assertEquals(0, history.nrModelsAlive(0));
    }

    @Test
    void weightedParticlesAreNormalizedWithinTheModel() {
        InMemoryHistory history = new InMemoryHistory(2);
        history.appendPopulation(0, 1.0,
            List.of(particle(0, 1.0, 0.1), particle(0, 2.0, 0.3), particle(1, 5.0, 0.6)), 3);

        WeightedParameters model0 = history.weightedParticles(0, 0);
        assertEquals(2, model0.size());
        assertArrayEquals(new double[]{0.25, 0.75}, model0.weights(), 1e-12);
    }

    @Test
    void sampleFromModelsSkipsDeadModels() {
        InMemoryHistory history = new InMemoryHistory(3);
        history.appendPopulation(0, 1.0, List.of(particle(0, 1.0, 0.5), particle(2, 1.0, 0.5)), 2);
        UniformRandomProvider rng = RandomSources.create(4L);
        int[] counts = new int[3];
        for (int i = 0; i < 2000; i++) {
            counts[history.sampleFromModels(0, rng)]++;
        }
        assertEquals(0, counts[1]);
        assertTrue(counts[0] > 800 && counts[2] > 800);
    }

    @Test
    void initialDataMustNameEveryModel() {
        InMemoryHistory history = new InMemoryHistory(2);
        InitialData oneName = new InitialData(-1, null, Map.of("y", 1.0), Map.of(), List.of("a"), "{}", "{}");
        assertThrows(IllegalArgumentException.class, () -> history.storeInitialData(oneName));

        InitialData data = new InitialData(0, Parameter.of("x", 1.0), Map.of("y", 1.0), Map.of("k", "v"),
            List.of("a", "b"), "{}", "{}");
        history.storeInitialData(data);
        assertSame(data, history.getInitialData());
        assertFalse(history.isDone());
        history.done();
        assertTrue(history.isDone());
    }
}
