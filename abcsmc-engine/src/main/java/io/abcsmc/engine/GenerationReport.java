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

/**
 * Per-generation summary produced by {@link AbcSmc#run}.
 *
 * @param t generation index
 * @param epsilon acceptance threshold
 * @param accepted accepted particles, zero-weight ones included
 * @param storedParticles particles stored in the population
 * @param evaluations propose/evaluate cycles consumed
 * @param simulations model simulations consumed
 * @param acceptanceRate accepted over evaluations
 * @param zeroNormalizationEvents particles given weight 0 for a degenerate importance weight
 * @param exhaustedEvaluations evaluations dropped at the per-particle cap
 * @param failedEvaluations evaluations that threw
 * @param ok false if the sampler returned a degraded sample
 */
public record GenerationReport(int t,
                               double epsilon,
                               int accepted,
                               int storedParticles,
                               long evaluations,
                               long simulations,
                               double acceptanceRate,
                               long zeroNormalizationEvents,
                               long exhaustedEvaluations,
                               long failedEvaluations,
                               boolean ok) {
}
