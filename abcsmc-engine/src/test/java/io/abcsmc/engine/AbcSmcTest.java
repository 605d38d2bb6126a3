package io.abcsmc.engine;

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

import io.abcsmc.engine.epsilon.ConstantEpsilon;
import io.abcsmc.engine.epsilon.ListEpsilon;
import io.abcsmc.engine.model.FunctionModel;
import io.abcsmc.engine.model.Model;
import io.abcsmc.engine.sampler.MappingStrategy;
import io.abcsmc.engine.sampler.Sampler;
import io.abcsmc.engine.storage.InMemoryHistory;
import io.abcsmc.model.Particle;
import io.abcsmc.model.Population;
import io.abcsmc.model.scalar.UniformScalarModel;
import io.abcsmc.random.ParameterPrior;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("integration")
class AbcSmcTest {

    private static final Map<String, Double> OBSERVED = Map.of("y", 1.0);
    private static final ParameterPrior X_PRIOR =
        ParameterPrior.builder().add("x", new UniformScalarModel(0.0, 2.0)).build();

    private static final Model SHIFTED = FunctionModel.of("shifted",
        (theta, rng) -> Map.of("y", theta.get("x") + (rng.nextDouble() - 0.5) * 0.2));
    private static final Model DOUBLED = FunctionModel.of("doubled",
        (theta, rng) -> Map.of("y", 2.0 * theta.get("x") + (rng.nextDouble() - 0.5) * 0.2));
    private static final Model NEVER = FunctionModel.of("never", (theta, rng) -> Map.of("y", 1000.0));

    private static AbcSmc.Builder engine(List<Model> models, AbcSmcOptions options) {
        List<ParameterPrior> priors = new ArrayList<>();
        for (int i = 0; i < models.size(); i++) {
            priors.add(X_PRIOR);
        }
        return AbcSmc.builder().models(models).parameterPriors(priors).options(options);
    }

    private static AbcSmcOptions.Builder options(int n) {
        return AbcSmcOptions.builder(n).seed(2024L).stopIfOnlySingleModelAlive(false);
    }

    private static double weightSum(Population population) {
        return population.getParticles().stream().mapToDouble(Particle::getWeight).sum();
    }

    @Test
    void twoModelsFirstGenerationIsCompleteAndNormalized() {
        AbcSmc abc = engine(List.of(SHIFTED, DOUBLED), options(50).build())
            .epsilon(ListEpsilon.of(0.5, 0.3))
            .build();
        InMemoryHistory history = new InMemoryHistory(2);
        abc.newRun(OBSERVED, history);

        AbcSmcResult result = abc.run(new int[]{1, 1}, 0.0);

        Population first = history.getPopulation(0);
        assertEquals(50, first.getNrAccepted());
        assertEquals(50, result.reports().get(0).accepted());
        assertEquals(1.0, weightSum(first), 1e-9);
        assertEquals(1.0, Arrays.stream(history.getModelProbabilities(0)).sum(), 1e-9);
        assertEquals(1.0, weightSum(history.getPopulation(1)), 1e-9);
        assertEquals(StopReason.SCHEDULE_EXHAUSTED, result.stopReason());
        assertTrue(history.isDone());
        assertEquals(List.of("shifted", "doubled"), history.getInitialData().modelNames());
        assertEquals("50", history.getInitialData().metadata().get("nr_particles"));
    }

    @Test
    void storedParticlesAreValidWithNonNegativeWeights() {
        AbcSmc abc = engine(List.of(SHIFTED, DOUBLED), options(40).build())
            .epsilon(ListEpsilon.of(0.6, 0.4, 0.2))
            .build();
        InMemoryHistory history = new InMemoryHistory(2);
        abc.newRun(OBSERVED, history);
        abc.run(new int[]{2, 2, 2}, 0.0);

        for (int t = 0; t <= history.maxT(); t++) {
            Population population = history.getPopulation(t);
            for (Particle particle : population.getParticles()) {
                assertTrue(particle.isValid());
                assertThat(particle.getWeight()).isGreaterThan(0.0);
                assertThat(particle.getDistances()).allMatch(d -> d <= population.getEpsilon());
            }
        }
    }

    @Test
    void runsAtMostOneGenerationPerScheduleEntry() {
        AbcSmc abc = engine(List.of(SHIFTED), options(30).build())
            .epsilon(ListEpsilon.of(1.0, 0.5, 0.3))
            .build();
        InMemoryHistory history = new InMemoryHistory(1);
        abc.newRun(OBSERVED, history);

        AbcSmcResult result = abc.run(new int[]{1, 1, 1}, Double.NEGATIVE_INFINITY);

        assertEquals(3, result.reports().size());
        assertEquals(2, result.lastT());
        assertEquals(2, history.maxT());
        assertEquals(StopReason.SCHEDULE_EXHAUSTED, result.stopReason());
    }

    @Test
    void stopsAfterFirstGenerationWhenEpsilonIsAlreadySmallEnough() {
        AbcSmc abc = engine(List.of(SHIFTED), options(20).build())
            .epsilon(new ConstantEpsilon(0.5))
            .build();
        InMemoryHistory history = new InMemoryHistory(1);
        abc.newRun(OBSERVED, history);

        AbcSmcResult result = abc.run(new int[]{1, 1, 1}, 0.5);

        assertEquals(StopReason.MIN_EPSILON_REACHED, result.stopReason());
        assertEquals(1, result.reports().size());
        assertEquals(0, history.maxT());
    }

    @Test
    void priorSampleIsMemoizedUntilReset() {
        AbcSmc abc = engine(List.of(SHIFTED, DOUBLED), options(25).build()).build();

        List<Map<String, Double>> first = abc.priorSample();
        assertSame(first, abc.priorSample());
        assertEquals(25, first.size());

        abc.resetPriorSample();
        assertNotSame(first, abc.priorSample());
    }

    @Test
    void modelThatNeverAcceptsDiesOutAndStaysDead() {
        AbcSmc abc = engine(List.of(SHIFTED, NEVER), options(30).build())
            .epsilon(ListEpsilon.of(0.5, 0.4))
            .build();
        InMemoryHistory history = new InMemoryHistory(2);
        abc.newRun(OBSERVED, history);

        abc.run(new int[]{1, 1}, 0.0);

        assertEquals(0.0, history.getModelProbabilities(0)[1]);
        assertEquals(1, history.nrModelsAlive(0));
        assertTrue(history.getPopulation(0).weightedParameters(1).isEmpty());
        assertThat(history.getPopulation(1).getParticles()).allMatch(p -> p.getModelIndex() == 0);
    }

    @Test
    void stopsWhenASingleModelIsLeft() {
        AbcSmc abc = engine(List.of(SHIFTED, NEVER), options(30).stopIfOnlySingleModelAlive(true).build())
            .epsilon(ListEpsilon.of(0.5, 0.4, 0.3))
            .build();
        abc.newRun(OBSERVED, new InMemoryHistory(2));

        AbcSmcResult result = abc.run(new int[]{1, 1, 1}, 0.0);

        assertEquals(StopReason.SINGLE_MODEL_ALIVE, result.stopReason());
        assertEquals(0, result.lastT());
    }

    @Test
    void emptyPopulationStopsTheRun() {
        AbcSmcOptions options = options(10).maxNrEvaluationsPerGeneration(20).build();
        AbcSmc abc = engine(List.of(NEVER), options).epsilon(new ConstantEpsilon(1.0)).build();
        InMemoryHistory history = new InMemoryHistory(1);
        abc.newRun(OBSERVED, history);

        AbcSmcResult result = abc.run(new int[]{1, 1}, 0.0);

        assertEquals(StopReason.EMPTY_POPULATION, result.stopReason());
        GenerationReport report = result.reports().get(0);
        assertFalse(report.ok());
        assertEquals(0, report.storedParticles());
        assertEquals(20, report.evaluations());
        assertTrue(history.getPopulation(0).isEmpty());
    }

    @Test
    void incompleteGenerationIsReported() {
        AbcSmcOptions options = options(50).minNrParticlesPerPopulation(50).maxNrEvaluationsPerGeneration(5).build();
        AbcSmc abc = engine(List.of(SHIFTED), options).epsilon(new ConstantEpsilon(100.0)).build();
        abc.newRun(OBSERVED, new InMemoryHistory(1));

        AbcSmcResult result = abc.run(new int[]{1, 1}, 0.0);

        assertEquals(StopReason.INCOMPLETE_GENERATION, result.stopReason());
        assertEquals(5, result.reports().get(0).accepted());
    }

    @Test
    void incompleteGenerationCanFailTheRun() {
        AbcSmcOptions options = options(50).minNrParticlesPerPopulation(50).maxNrEvaluationsPerGeneration(5)
            .failOnIncompleteGeneration(true).build();
        AbcSmc abc = engine(List.of(SHIFTED), options).epsilon(new ConstantEpsilon(100.0)).build();
        InMemoryHistory history = new InMemoryHistory(1);
        abc.newRun(OBSERVED, history);

        IncompleteGenerationException e = assertThrows(IncompleteGenerationException.class,
            () -> abc.run(new int[]{1, 1}, 0.0));

        assertEquals(0, e.getReport().t());
        assertEquals(0, history.maxT());
        assertTrue(history.isDone());
    }

    @Test
    void sameSeedReproducesTheRun() {
        List<Particle> first = runOnce();
        List<Particle> second = runOnce();
        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getParameter(), second.get(i).getParameter());
            assertEquals(first.get(i).getWeight(), second.get(i).getWeight());
        }
    }

    private static List<Particle> runOnce() {
        AbcSmc abc = engine(List.of(SHIFTED, DOUBLED), options(30).build()).build();
        InMemoryHistory history = new InMemoryHistory(2);
        abc.newRun(OBSERVED, history);
        abc.run(new int[]{1, 1}, 0.0);
        return history.getPopulation(history.maxT()).getParticles();
    }

    @Test
    void posteriorConcentratesAroundTheTruth() {
        AbcSmc abc = engine(List.of(SHIFTED), options(200).build())
            .sampler(new Sampler(new MappingStrategy(3)))
            .build();
        InMemoryHistory history = new InMemoryHistory(1);
        abc.newRun(OBSERVED, history);

        AbcSmcResult result = abc.run(new int[]{1, 1, 1, 1}, 0.0);

        Population last = history.getPopulation(result.lastT());
        double mean = 0.0;
        for (Particle particle : last.getParticles()) {
            mean += particle.getWeight() * particle.getParameter().get("x");
        }
        assertEquals(1.0, mean, 0.15);
        assertThat(last.getEpsilon()).isLessThan(history.getPopulation(0).getEpsilon());
    }

    @Test
    void loadRunContinuesAfterTheLastGeneration() {
        InMemoryHistory history = new InMemoryHistory(1);
        AbcSmc first = engine(List.of(SHIFTED), options(30).build()).build();
        first.newRun(OBSERVED, history);
        first.run(new int[]{1}, 0.0);

        AbcSmc resumed = engine(List.of(SHIFTED), options(30).seed(7L).build()).build();
        assertThrows(IllegalArgumentException.class, () -> resumed.newRun(OBSERVED, history));
        resumed.loadRun(OBSERVED, history);
        assertEquals(1, resumed.getNextT());

        AbcSmcResult result = resumed.run(new int[]{1}, 0.0);

        assertEquals(1, result.lastT());
        assertEquals(1, history.maxT());
    }

    @Test
    void secondRunOnTheSameEngineDerivesItsOwnEpsilons() {
        AbcSmc abc = engine(List.of(SHIFTED), options(50).build()).build();
        InMemoryHistory first = new InMemoryHistory(1);
        abc.newRun(OBSERVED, first);
        AbcSmcResult firstResult = abc.run(new int[]{1, 1}, 0.0);

        InMemoryHistory second = new InMemoryHistory(1);
        abc.newRun(Map.of("y", 1.9), second);
        AbcSmcResult secondResult = abc.run(new int[]{1, 1}, 0.0);

        assertEquals(2, secondResult.reports().size());
        assertEquals(second.getWeightedDistances(0).weightedMedian(), secondResult.reports().get(1).epsilon(), 1e-12);
        assertEquals(first.getWeightedDistances(0).weightedMedian(), firstResult.reports().get(1).epsilon(), 1e-12);
    }

    @Test
    void stopEndsTheRunAfterStoringTheCurrentGeneration() {
        AtomicReference<AbcSmc> engine = new AtomicReference<>();
        AtomicBoolean armed = new AtomicBoolean();
        Model stopping = FunctionModel.of("stopping", (theta, rng) -> {
            if (armed.getAndSet(false)) {
                engine.get().stop();
            }
            return Map.of("y", theta.get("x"));
        });
        AbcSmc abc = engine(List.of(stopping), options(10).build()).epsilon(new ConstantEpsilon(100.0)).build();
        engine.set(abc);
        InMemoryHistory history = new InMemoryHistory(1);
        abc.newRun(OBSERVED, history);
        armed.set(true);

        AbcSmcResult result = abc.run(new int[]{1, 1, 1}, 0.0);

        assertEquals(StopReason.STOPPED, result.stopReason());
        assertEquals(1, result.reports().size());
        GenerationReport report = result.reports().get(0);
        assertFalse(report.ok());
        assertEquals(1, report.accepted());
        assertEquals(0, history.maxT());
        assertTrue(history.isDone());
    }

    @Test
    void stopRequestedBeforeRunIsWithdrawn() {
        AbcSmc abc = engine(List.of(SHIFTED), options(10).build()).epsilon(new ConstantEpsilon(100.0)).build();
        InMemoryHistory history = new InMemoryHistory(1);
        abc.newRun(OBSERVED, history);
        abc.stop();

        AbcSmcResult result = abc.run(new int[]{1}, 0.0);

        assertEquals(StopReason.SCHEDULE_EXHAUSTED, result.stopReason());
        assertEquals(10, result.reports().get(0).accepted());
        assertTrue(result.reports().get(0).ok());
    }

    @Test
    void rejectsInconsistentConfiguration() {
        AbcSmcOptions options = options(10).build();
        assertThrows(IllegalArgumentException.class, () -> AbcSmc.builder()
            .models(List.of(SHIFTED, DOUBLED)).parameterPriors(List.of(X_PRIOR)).options(options).build());
        assertThrows(IllegalArgumentException.class, () -> AbcSmc.builder().options(options).build());

        AbcSmc abc = engine(List.of(SHIFTED), options).build();
        assertThrows(IllegalStateException.class, () -> abc.run(new int[]{1}, 0.0));
        assertThrows(IllegalArgumentException.class, () -> abc.newRun(OBSERVED, new InMemoryHistory(2)));
    }
}
