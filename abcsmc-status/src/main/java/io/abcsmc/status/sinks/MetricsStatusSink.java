package io.abcsmc.status.sinks;

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
import io.abcsmc.status.eventing.StatusSink;
import io.abcsmc.status.eventing.StatusUpdate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A sink that keeps per-task counters in memory.
 *
 * <p>Useful in tests and for post-run reports:
 * <pre>{@code
 * MetricsStatusSink metrics = new MetricsStatusSink();
 * sampler.setStatusSink(metrics);
 * ...
 * metrics.getMetrics("t=0").getFinalState(); // SUCCESS
 * }</pre>
 */
public class MetricsStatusSink implements StatusSink {

    public static class TaskMetrics {
        private final AtomicLong startTime = new AtomicLong();
        private final AtomicLong endTime = new AtomicLong();
        private final AtomicLong updateCount = new AtomicLong();
        private volatile long target;
        private volatile StatusUpdate lastUpdate;
        private volatile RunState finalState;

        public long getDuration() {
            long end = endTime.get();
            return end > 0 ? end - startTime.get() : System.currentTimeMillis() - startTime.get();
        }

        public long getUpdateCount() {
            return updateCount.get();
        }

        public long getTarget() {
            return target;
        }

        public StatusUpdate getLastUpdate() {
            return lastUpdate;
        }

        /**
         * @return the terminal run state, or null while the task is active
         */
        public RunState getFinalState() {
            return finalState;
        }

        public boolean isFinished() {
            return finalState != null;
        }
    }

    private final Map<String, TaskMetrics> metricsMap = new ConcurrentHashMap<>();
    private final AtomicLong totalTasksStarted = new AtomicLong();
    private final AtomicLong totalTasksFinished = new AtomicLong();
    private final AtomicLong totalUpdates = new AtomicLong();

    @Override
    public void taskStarted(String task, long target) {
        TaskMetrics metrics = new TaskMetrics();
        metrics.startTime.set(System.currentTimeMillis());
        metrics.target = target;
        metricsMap.put(task, metrics);
        totalTasksStarted.incrementAndGet();
    }

    @Override
    public void taskUpdate(String task, StatusUpdate status) {
        TaskMetrics metrics = metricsMap.get(task);
        if (metrics != null) {
            metrics.updateCount.incrementAndGet();
            metrics.lastUpdate = status;
        }
        totalUpdates.incrementAndGet();
    }

    @Override
    public void taskFinished(String task, StatusUpdate status) {
        TaskMetrics metrics = metricsMap.get(task);
        if (metrics != null) {
            metrics.endTime.set(System.currentTimeMillis());
            metrics.lastUpdate = status;
            metrics.finalState = status.runstate;
        }
        totalTasksFinished.incrementAndGet();
    }

    public TaskMetrics getMetrics(String task) {
        return metricsMap.get(task);
    }

    public Map<String, TaskMetrics> getAllMetrics() {
        return Map.copyOf(metricsMap);
    }

    public long getTotalTasksStarted() {
        return totalTasksStarted.get();
    }

    public long getTotalTasksFinished() {
        return totalTasksFinished.get();
    }

    public long getTotalUpdates() {
        return totalUpdates.get();
    }

    public void clearMetrics() {
        metricsMap.clear();
    }
}
