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

import io.abcsmc.engine.model.Model;
import io.abcsmc.engine.sampler.Candidate;
import io.abcsmc.engine.sampler.Evaluator;
import io.abcsmc.model.Evaluation;
import io.abcsmc.model.Particle;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Simulates a prior candidate once and keeps only its summary statistics.
 * Used to calibrate distances and thresholds before the first generation.
 */
public final class PriorSummaryEvaluator implements Evaluator {

    private final List<Model> models;
    private final UnaryOperator<Map<String, Double>> summaryStatistics;

    public PriorSummaryEvaluator(List<Model> models, UnaryOperator<Map<String, Double>> summaryStatistics) {
        this.models = List.copyOf(models);
        this.summaryStatistics = Objects.requireNonNull(summaryStatistics, "summaryStatistics");
    }

    @Override
    public Evaluation evaluate(Candidate candidate, UniformRandomProvider rng) {
        Map<String, Double> stats = models.get(candidate.modelIndex())
            .summaryStatistics(candidate.parameter(), summaryStatistics, rng)
            .summaryStatistics();
        return Evaluation.of(Particle.ofSummaryStatistics(candidate.modelIndex(), candidate.parameter(), stats), 1);
    }
}
