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
 * Result of one propose/evaluate/accept cycle on a worker, consolidated into a
 * {@link Sample} on the calling thread.
 *
 * @param evaluation the evaluation, null if the cycle failed
 * @param accepted whether the evaluation was accepted
 * @param failure the exception thrown by the cycle, null on success
 */
public record Outcome(Evaluation evaluation, boolean accepted, RuntimeException failure) {

    static Outcome of(Evaluation evaluation, boolean accepted) {
        return new Outcome(evaluation, accepted, null);
    }

    static Outcome failed(RuntimeException failure) {
        return new Outcome(null, false, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }

    void appendTo(Sample sample) {
        if (failure != null) {
            sample.recordFailedEvaluation();
        } else {
            sample.append(evaluation, accepted);
        }
    }
}
