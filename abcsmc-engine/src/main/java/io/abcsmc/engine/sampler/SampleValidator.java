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
import io.abcsmc.model.Sample;

/**
 * Output checks applied to every sample, whatever strategy produced it.
 *
 * <ol>
 *   <li>An ok sample holds exactly {@code n} accepted evaluations; a degraded
 *       one holds at most {@code n}.</li>
 *   <li>No accepted particle is still preliminary.</li>
 *   <li>Accepted weights are normalized and sum to one whenever their total is
 *       positive.</li>
 * </ol>
 *
 * <p>Violations are programming errors in a strategy and are reported as
 * {@link IllegalStateException}.
 */
public final class SampleValidator {

    static final double WEIGHT_TOLERANCE = 1e-9;

    /**
     * Validates and normalizes a sample in place.
     *
     * @param sample the raw sample
     * @param n requested number of accepted particles
     * @param strategyName producing strategy, for messages
     * @return the same sample, normalized
     * @throws IllegalStateException if a check fails
     */
    public Sample validate(Sample sample, int n, String strategyName) {
        int accepted = sample.getNrAccepted();
        if (sample.isOk() && accepted != n) {
            throw new IllegalStateException(strategyName + " returned " + accepted
                + " accepted particles for an ok sample, expected " + n);
        }
        if (!sample.isOk() && accepted > n) {
            throw new IllegalStateException(strategyName + " returned " + accepted
                + " accepted particles, more than the " + n + " requested");
        }
        for (Evaluation evaluation : sample.getAccepted()) {
            if (evaluation.getParticle().isPreliminary()) {
                throw new IllegalStateException(strategyName + " returned a preliminary particle: "
                    + evaluation.getParticle());
            }
        }

        sample.normalizeWeights();

        double total = 0.0;
        for (Evaluation evaluation : sample.getAccepted()) {
            total += evaluation.getParticle().getWeight();
        }
        if (total > 0.0 && Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException("Accepted weights sum to " + total + " after normalization");
        }
        return sample;
    }
}
