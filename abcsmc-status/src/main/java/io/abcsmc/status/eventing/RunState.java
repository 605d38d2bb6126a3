package io.abcsmc.status.eventing;

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
 * Execution state of a tracked sampling task, typically one generation of particles.
 *
 * <p>State Transitions:
 * <ul>
 *   <li><strong>PENDING → RUNNING:</strong> first proposal submitted</li>
 *   <li><strong>RUNNING → SUCCESS:</strong> the requested number of particles was accepted</li>
 *   <li><strong>RUNNING → DEGRADED:</strong> the evaluation budget ran out before enough acceptances</li>
 *   <li><strong>RUNNING → FAILED:</strong> sampling aborted with an error</li>
 *   <li><strong>RUNNING → CANCELLED:</strong> the sampler was stopped while work was in flight</li>
 * </ul>
 *
 * <p>{@link #SUCCESS}, {@link #DEGRADED}, {@link #FAILED} and {@link #CANCELLED} are terminal.
 *
 * @see StatusUpdate
 */
public enum RunState {
    /**
     * Task is created but no proposal has been evaluated yet.
     */
    PENDING("⏳"),

    /**
     * Proposals are being evaluated.
     */
    RUNNING("🔄"),

    /**
     * All requested particles were accepted (terminal state).
     */
    SUCCESS("✅"),

    /**
     * Sampling ended with fewer accepted particles than requested (terminal state).
     */
    DEGRADED("⚠"),

    /**
     * Sampling aborted due to an error (terminal state).
     */
    FAILED("❌"),

    /**
     * Sampling was cancelled (terminal state).
     */
    CANCELLED("🚫");

    private final String glyph;

    RunState(String glyph) {
        this.glyph = glyph;
    }

    /**
     * Returns the Unicode glyph associated with this state for display purposes.
     *
     * @return a Unicode character representing this state
     */
    public String getGlyph() {
        return glyph;
    }

    /**
     * @return true if no further transitions are expected from this state
     */
    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
