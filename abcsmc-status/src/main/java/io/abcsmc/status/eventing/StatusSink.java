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

import io.abcsmc.status.sinks.LoggerStatusSink;
import io.abcsmc.status.sinks.MetricsStatusSink;
import io.abcsmc.status.sinks.NoopStatusSink;

/**
 * A contract for objects that receive progress events from sampling tasks.
 *
 * <p>A task is one call that fills a population, identified by a short label
 * such as {@code "t=3"}. Sinks receive three kinds of events in order:
 * <ol>
 *   <li><strong>taskStarted:</strong> called once before the first proposal</li>
 *   <li><strong>taskUpdate:</strong> called zero or more times while proposals are evaluated</li>
 *   <li><strong>taskFinished:</strong> called once with the terminal update</li>
 * </ol>
 *
 * <h2>Built-in Implementations</h2>
 * <ul>
 *   <li>{@link LoggerStatusSink} - Log4j 2 integration</li>
 *   <li>{@link MetricsStatusSink} - in-memory counters</li>
 *   <li>{@link NoopStatusSink} - discards everything</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Parallel samplers publish updates from worker threads, so implementations
 * must be thread-safe. Sinks must never throw; a sink failure must not change
 * the outcome of sampling.</p>
 *
 * @see StatusUpdate
 */
public interface StatusSink {

    /**
     * Called when sampling for a task begins.
     *
     * @param task the task label
     * @param target the number of particles requested
     */
    void taskStarted(String task, long target);

    /**
     * Called when the task's counters change.
     *
     * @param task the task label
     * @param status the current progress snapshot
     */
    void taskUpdate(String task, StatusUpdate status);

    /**
     * Called once when sampling for a task ends.
     *
     * @param task the task label
     * @param status the terminal progress snapshot
     */
    void taskFinished(String task, StatusUpdate status);
}
