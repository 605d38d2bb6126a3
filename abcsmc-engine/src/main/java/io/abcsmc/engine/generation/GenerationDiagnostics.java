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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Degeneracy counters for one generation, updated concurrently by sampling
 * workers and read by the engine once sampling has finished.
 */
public final class GenerationDiagnostics {

    private final AtomicLong zeroNormalizationEvents = new AtomicLong();
    private final AtomicLong exhaustedEvaluations = new AtomicLong();

    void recordZeroNormalization() {
        zeroNormalizationEvents.incrementAndGet();
    }

    void recordExhaustedEvaluation() {
        exhaustedEvaluations.incrementAndGet();
    }

    /**
     * @return particles whose importance-weight normalization was zero (or whose
     *         weight came out non-finite) and which were given weight 0
     */
    public long getZeroNormalizationEvents() {
        return zeroNormalizationEvents.get();
    }

    /**
     * @return evaluations dropped because they hit the per-particle simulation cap
     */
    public long getExhaustedEvaluations() {
        return exhaustedEvaluations.get();
    }

    @Override
    public String toString() {
        return "GenerationDiagnostics{zeroNormalization=" + zeroNormalizationEvents.get() +
            ", exhausted=" + exhaustedEvaluations.get() + '}';
    }
}
