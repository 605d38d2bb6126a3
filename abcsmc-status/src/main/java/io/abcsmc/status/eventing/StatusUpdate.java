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
 * Immutable snapshot of a sampling task's progress.
 *
 * <p>Progress is the fraction of the target acceptance count reached so far,
 * clamped to [0, 1]. The raw counters are carried alongside so sinks can
 * render acceptance rates without tracking state themselves.
 *
 * <pre>{@code
 * StatusUpdate update = new StatusUpdate(RunState.RUNNING, 37, 100, 412);
 * update.progress;        // 0.37
 * update.acceptanceRate(); // 37 / 412
 * }</pre>
 *
 * @see StatusSink
 */
public class StatusUpdate {
    public final double progress;
    public final RunState runstate;
    public final long timestamp;
    public final long accepted;
    public final long target;
    public final long evaluations;

    /**
     * Creates an update with the current timestamp.
     *
     * @param runstate the task's current execution state
     * @param accepted number of accepted particles so far
     * @param target number of particles requested
     * @param evaluations number of proposals evaluated so far
     */
    public StatusUpdate(RunState runstate, long accepted, long target, long evaluations) {
        this.runstate = runstate;
        this.accepted = accepted;
        this.target = target;
        this.evaluations = evaluations;
        this.progress = target > 0 ? Math.min(1.0, (double) accepted / target) : 1.0;
        this.timestamp = System.currentTimeMillis();
    }

    /**
     * @return accepted / evaluations, or 0.0 before the first evaluation
     */
    public double acceptanceRate() {
        return evaluations > 0 ? (double) accepted / evaluations : 0.0;
    }

    @Override
    public String toString() {
        return String.format("%s %d/%d accepted [%.1f%%], %d evaluations",
            runstate.getGlyph(), accepted, target, progress * 100, evaluations);
    }
}
