package io.abcsmc.random.transition;

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
import io.abcsmc.model.WeightedParameters;
import io.abcsmc.random.RandomSources;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class MultivariateNormalTransitionTest {

    private static WeightedParameters sample(double... xs) {
        List<Parameter> parameters = new ArrayList<>();
        double[] weights = new double[xs.length];
        for (int i = 0; i < xs.length; i++) {
            parameters.add(Parameter.of("x", xs[i]));
            weights[i] = 1.0;
        }
        return WeightedParameters.normalized(parameters, weights);
    }

    @Test
    void oneDimensionalDensityIntegratesToOne() {
        Transition.Fitted fitted = new MultivariateNormalTransition().fit(sample(-1.0, 0.0, 0.5, 2.0));
        double integral = 0.0;
        double step = 0.001;
        for (double x = -15.0; x <= 15.0; x += step) {
            integral += fitted.pdf(Parameter.of("x", x)) * step;
        }
        assertEquals(1.0, integral, 1e-3);
    }

    @Test
    void singleParticleStillHasPositiveDensity() {
        Transition.Fitted fitted = new MultivariateNormalTransition().fit(sample(3.0));
        assertTrue(fitted.pdf(Parameter.of("x", 3.0)) > 0.0);
        Parameter drawn = fitted.rvs(RandomSources.create(1L));
        assertEquals(3.0, drawn.get("x"), 1e-2);
    }

    @Test
    void identicalParticlesInTwoDimensionsAreDecomposable() {
        List<Parameter> parameters = List.of(
            Parameter.of("a", 1.0, "b", 2.0),
            Parameter.of("a", 1.0, "b", 2.0));
        WeightedParameters wp = WeightedParameters.normalized(parameters, new double[]{1.0, 1.0});
        Transition.Fitted fitted = new MultivariateNormalTransition().fit(wp);
        assertTrue(fitted.pdf(Parameter.of("a", 1.0, "b", 2.0)) > 0.0);
    }

    @Test
    void drawsCenterOnWeightedParticles() {
        List<Parameter> parameters = List.of(Parameter.of("x", 0.0), Parameter.of("x", 10.0));
        WeightedParameters wp = WeightedParameters.normalized(parameters, new double[]{0.9, 0.1});
        Transition.Fitted fitted = new MultivariateNormalTransition(0.01).fit(wp);
        UniformRandomProvider rng = RandomSources.create(17L);
        SummaryStatistics stats = new SummaryStatistics();
        for (int i = 0; i < 20_000; i++) {
            stats.addValue(fitted.rvs(rng).get("x"));
        }
        assertEquals(1.0, stats.getMean(), 0.1);
    }

    @Test
    void foreignParameterHasZeroDensity() {
        Transition.Fitted fitted = new MultivariateNormalTransition().fit(sample(0.0, 1.0));
        assertEquals(0.0, fitted.pdf(Parameter.of("y", 0.0)), 0.0);
    }

    @Test
    void parameterlessModelIsPointMass() {
        WeightedParameters wp = WeightedParameters.normalized(List.of(Parameter.empty()), new double[]{1.0});
        Transition.Fitted fitted = new MultivariateNormalTransition().fit(wp);
        assertEquals(0, fitted.rvs(RandomSources.create(1L)).size());
        assertEquals(1.0, fitted.pdf(Parameter.empty()), 0.0);
    }

    @Test
    void emptySampleAndBadSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new MultivariateNormalTransition().fit(WeightedParameters.empty()));
        assertThrows(IllegalArgumentException.class, () -> new MultivariateNormalTransition(0.0));
        assertThrows(IllegalArgumentException.class, () -> new MultivariateNormalTransition(1.0, -1.0));
    }

    @Test
    void silvermanFactorShrinksWithSampleSize() {
        assertTrue(MultivariateNormalTransition.silvermanFactor(1000, 1)
            < MultivariateNormalTransition.silvermanFactor(10, 1));
    }
}
