package io.abcsmc.engine.distance;

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class DistanceFunctionTest {

    private static final Map<String, Double> OBSERVED = Map.of("a", 0.0, "b", 0.0);

    @Test
    void euclideanByDefault() {
        assertEquals(5.0, new PNormDistance().distance(Map.of("a", 3.0, "b", 4.0), OBSERVED), 1e-12);
    }

    @Test
    void manhattanAndMaximumNorms() {
        Map<String, Double> simulated = Map.of("a", -3.0, "b", 4.0);
        assertEquals(7.0, new PNormDistance(1.0).distance(simulated, OBSERVED), 1e-12);
        assertEquals(4.0, new PNormDistance(Double.POSITIVE_INFINITY).distance(simulated, OBSERVED), 1e-12);
    }

    @Test
    void weightsScaleEachStatistic() {
        PNormDistance weighted = new PNormDistance(1.0, Map.of("a", 0.5));
        assertEquals(1.5 + 4.0, weighted.distance(Map.of("a", 3.0, "b", 4.0), OBSERVED), 1e-12);
    }

    @Test
    void extraSimulatedStatisticsAreIgnored() {
        Map<String, Double> simulated = Map.of("a", 1.0, "b", 0.0, "unused", 100.0);
        assertEquals(1.0, new PNormDistance(1.0).distance(simulated, OBSERVED), 1e-12);
    }

    @Test
    void missingStatisticIsAnError() {
        assertThrows(IllegalArgumentException.class,
            () -> new PNormDistance().distance(Map.of("a", 1.0), OBSERVED));
    }

    @Test
    void rejectsInvalidNormOrWeights() {
        assertThrows(IllegalArgumentException.class, () -> new PNormDistance(0.5));
        assertThrows(IllegalArgumentException.class, () -> new PNormDistance(2.0, Map.of("a", -1.0)));
    }

    @Test
    void madScalesByPriorSpread() {
        MedianAbsoluteDeviationDistance distance = new MedianAbsoluteDeviationDistance();
        assertThrows(IllegalStateException.class, distance::getScales);

        distance.initialize(List.of(
            Map.of("a", 1.0, "b", 5.0),
            Map.of("a", 2.0, "b", 5.0),
            Map.of("a", 3.0, "b", 5.0),
            Map.of("a", 4.0, "b", 5.0),
            Map.of("a", 5.0, "b", 5.0)));

        // a: median 3, deviations {2,1,0,1,2}, MAD 1; b: constant, scale 1
        assertEquals(Map.of("a", 1.0, "b", 1.0), distance.getScales());
        assertEquals(3.0, distance.distance(Map.of("a", 2.0, "b", 1.0), Map.of("a", 0.0, "b", 0.0)), 1e-12);
        assertThat(distance.toJson()).contains("scales");
    }

    @Test
    void toJsonNamesTheFunction() {
        assertThat(new PNormDistance(1.0).toJson()).contains("\"name\":\"PNormDistance\"").contains("\"p\":1.0");
    }
}
