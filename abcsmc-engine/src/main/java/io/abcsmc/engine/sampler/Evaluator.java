package io.abcsmc.engine.sampler;

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

import io.abcsmc.model.Evaluation;
import org.apache.commons.rng.UniformRandomProvider;

/**
 * Simulates a candidate and turns the outcome into a weighted particle.
 *
 * <p>Same threading contract as {@link Proposal}.
 */
@FunctionalInterface
public interface Evaluator {

    /**
     * @param candidate the proposal to evaluate
     * @param rng random source owned by the calling worker
     * @return the evaluation, never null
     */
    Evaluation evaluate(Candidate candidate, UniformRandomProvider rng);
}
