package io.abcsmc.engine.generation;

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

import io.abcsmc.engine.distance.DistanceFunction;
import io.abcsmc.engine.model.Model;
import io.abcsmc.engine.model.ModelResult;
import io.abcsmc.engine.sampler.Candidate;
import io.abcsmc.engine.sampler.Evaluator;
import io.abcsmc.model.Evaluation;
import io.abcsmc.model.Parameter;
import io.abcsmc.model.Particle;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.function.UnaryOperator;

/**
 * Evaluates a candidate for one generation: simulates it
 * {@code attemptsBudget} times against {@code epsilon}, keeps the accepted
 * distances and statistics, and weights the particle.
 *
 * <p>If the budget is larger than the per-particle cap, simulation stops once
 * the cap is reached and the evaluation is returned
 * {@link Evaluation#exhausted exhausted}, whatever was accepted so far.
 *
 * <p>Immutable apart from the shared {@link GenerationDiagnostics}; safe to
 * call from several workers.
 */
public final class ParticleEvaluator implements Evaluator {

    private static final Logger logger = LogManager.getLogger(ParticleEvaluator.class);

    private final int t;
    private final double epsilon;
    private final int attemptsBudget;
    private final int maxAttemptsPerParticle;
    private final List<Model> models;
    private final ToDoubleFunction<Map<String, Double>> distanceToObserved;
    private final UnaryOperator<Map<String, Double>> summaryStatistics;
    private final ImportanceWeight importanceWeight;
    private final GenerationDiagnostics diagnostics;

    /**
     * @param t generation index
     * @param epsilon acceptance threshold of the generation
     * @param attemptsBudget simulations per candidate, at least 1
     * @param maxAttemptsPerParticle per-particle simulation cap, at least 1
     * @param models candidate models by index
     * @param distanceFunction distance function, already initialized
     * @param observed observed summary statistics
     * @param summaryStatistics maps raw model output to summary statistics
     * @param importanceWeight weighting of the generation
     * @param diagnostics degeneracy counters of the generation
     */
    public ParticleEvaluator(int t, double epsilon, int attemptsBudget, int maxAttemptsPerParticle,
                             List<Model> models, DistanceFunction distanceFunction,
                             Map<String, Double> observed, UnaryOperator<Map<String, Double>> summaryStatistics,
                             ImportanceWeight importanceWeight, GenerationDiagnostics diagnostics) {
        if (attemptsBudget < 1) {
            throw new IllegalArgumentException("Attempts budget must be >= 1, got: " + attemptsBudget);
        }
        if (maxAttemptsPerParticle < 1) {
            throw new IllegalArgumentException("Per-particle cap must be >= 1, got: " + maxAttemptsPerParticle);
        }
        this.t = t;
        this.epsilon = epsilon;
        this.attemptsBudget = attemptsBudget;
        this.maxAttemptsPerParticle = maxAttemptsPerParticle;
        this.models = List.copyOf(models);
        Objects.requireNonNull(distanceFunction, "distanceFunction");
        Map<String, Double> observedCopy = Map.copyOf(observed);
        this.distanceToObserved = stats -> distanceFunction.distance(stats, observedCopy);
        this.summaryStatistics = Objects.requireNonNull(summaryStatistics, "summaryStatistics");
        this.importanceWeight = Objects.requireNonNull(importanceWeight, "importanceWeight");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    @Override
    public Evaluation evaluate(Candidate candidate, UniformRandomProvider rng) {
        int m = candidate.modelIndex();
        Parameter parameter = candidate.parameter();
        Model model = models.get(m);
        List<Double> distances = new ArrayList<>();
        List<Map<String, Double>> statistics = new ArrayList<>();

        for (int attempt = 0; attempt < attemptsBudget; attempt++) {
            if (attempt >= maxAttemptsPerParticle) {
                diagnostics.recordExhaustedEvaluation();
                logger.warn("t={}: model {} at {} hit the per-particle cap of {} simulations, dropped",
                    t, m, parameter, maxAttemptsPerParticle);
                return Evaluation.exhausted(m, parameter, attempt);
            }
            ModelResult result = model.accept(parameter, summaryStatistics, distanceToObserved, epsilon, rng);
            logger.debug("t={} m={} θ={} distance={} accepted={}", t, m, parameter, result.distance(), result.accepted());
            if (result.accepted()) {
                distances.add(result.distance());
                statistics.add(result.summaryStatistics());
            }
        }

        double weight = 0.0;
        if (!distances.isEmpty()) {
            double acceptedFraction = (double) distances.size() / attemptsBudget;
            weight = importanceWeight.weight(m, parameter, acceptedFraction, diagnostics);
        }
        return Evaluation.of(new Particle(m, parameter, weight, distances, statistics), attemptsBudget);
    }

    public int getT() {
        return t;
    }

    public double getEpsilon() {
        return epsilon;
    }
}
