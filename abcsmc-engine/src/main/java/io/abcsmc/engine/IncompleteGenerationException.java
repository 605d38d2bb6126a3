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
 * Thrown by {@link AbcSmc#run} when a generation accepts fewer particles than
 * the configured minimum and the run is set to fail on that. The generation
 * has been stored before this is thrown.
 */
public class IncompleteGenerationException extends RuntimeException {

    private final GenerationReport report;

    public IncompleteGenerationException(GenerationReport report, int minNrParticles) {
        super("Generation " + report.t() + " accepted " + report.accepted()
            + " particles, fewer than the minimum of " + minNrParticles);
        this.report = report;
    }

    public GenerationReport getReport() {
        return report;
    }
}
