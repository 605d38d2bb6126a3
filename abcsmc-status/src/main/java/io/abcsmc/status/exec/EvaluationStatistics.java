package io.abcsmc.status.exec;

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

import io.abcsmc.status.eventing.RunState;
import io.abcsmc.status.eventing.StatusUpdate;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for the proposal evaluations of one sampling task.
 *
 * <p>Evaluations move through the following states:
 * <ul>
 *   <li><strong>Submitted:</strong> a proposal was handed to a worker</li>
 *   <li><strong>Completed:</strong> evaluation returned; it was either accepted or rejected</li>
 *   <li><strong>Failed:</strong> evaluation threw; the proposal is excluded from the sample</li>
 *   <li><strong>Cancelled:</strong> evaluation was abandoned once enough particles were accepted</li>
 *   <li><strong>Pending:</strong> submitted but not yet completed, failed or cancelled</li>
 * </ul>
 *
 * <p>These counters are the only mutable state shared across concurrent
 * evaluations of a generation, so every update is a single atomic operation.
 */
public final class EvaluationStatistics {
    private final AtomicLong submitted = new AtomicLong(0);
    private final AtomicLong completed = new AtomicLong(0);
    private final AtomicLong accepted = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private final AtomicLong cancelled = new AtomicLong(0);

    public long getSubmitted() {
        return submitted.get();
    }

    public long getCompleted() {
        return completed.get();
    }

    public long getAccepted() {
        return accepted.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long getCancelled() {
        return cancelled.get();
    }

    /**
     * @return submitted - (completed + failed + cancelled)
     */
    public long getPending() {
        return submitted.get() - completed.get() - failed.get() - cancelled.get();
    }

    /**
     * Evaluations that consumed a proposal, whether they completed or failed.
     *
     * @return completed + failed
     */
    public long getEvaluated() {
        return completed.get() + failed.get();
    }

    public double getAcceptanceRate() {
        long evaluated = getEvaluated();
        return evaluated > 0 ? (double) accepted.get() / evaluated : 0.0;
    }

    public void incrementSubmitted() {
        submitted.incrementAndGet();
    }

    /**
     * Records a completed evaluation.
     *
     * @param wasAccepted whether the evaluation passed the acceptance predicate
     */
    public void recordCompleted(boolean wasAccepted) {
        if (wasAccepted) {
            accepted.incrementAndGet();
        }
        completed.incrementAndGet();
    }

    public void incrementFailed() {
        failed.incrementAndGet();
    }

    public void incrementCancelled() {
        cancelled.incrementAndGet();
    }

    /**
     * Builds a progress snapshot from the current counters.
     *
     * @param state run state to report
     * @param target number of particles requested
     * @return a new update
     */
    public StatusUpdate snapshot(RunState state, long target) {
        return new StatusUpdate(state, accepted.get(), target, getEvaluated());
    }

    @Override
    public String toString() {
        return String.format(
            "EvaluationStatistics[submitted=%d, completed=%d, accepted=%d, failed=%d, cancelled=%d, pending=%d]",
            submitted.get(), completed.get(), accepted.get(), failed.get(), cancelled.get(), getPending());
    }
}
