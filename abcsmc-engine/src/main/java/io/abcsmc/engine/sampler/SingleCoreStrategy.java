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

import io.abcsmc.model.Sample;

/**
 * Sequential loop on the calling thread. Deterministic for a given seed.
 */
public final class SingleCoreStrategy implements SamplingStrategy {

    @Override
    public Sample sample(SamplingTask task) {
        Sample sample = task.newSample();
        task.started();
        while (sample.getNrAccepted() < task.n()) {
            if (task.isStopRequested()) {
                sample.markDegraded("stop requested");
                break;
            }
            if (sample.getNrEvaluations() >= task.maxEval()) {
                sample.markDegraded("evaluation budget of " + task.maxEval() + " exhausted");
                break;
            }
            Outcome outcome = task.evaluateOne(task.rng());
            outcome.appendTo(sample);
            if (outcome.accepted()) {
                task.progress();
            }
        }
        task.finished(sample);
        return sample;
    }
}
