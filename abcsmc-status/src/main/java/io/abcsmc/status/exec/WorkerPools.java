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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the worker pools used by parallel sampling strategies.
 *
 * <p>Threads are daemon threads named {@code <prefix>-<n>} so that an
 * abandoned sampler never keeps the JVM alive and thread dumps show which
 * sampler owns which worker.
 *
 * <pre>{@code
 * ExecutorService pool = WorkerPools.newFixedPool("abcsmc-worker", WorkerPools.defaultParallelism());
 * try {
 *     ...
 * } finally {
 *     WorkerPools.shutdown(pool, Duration.ofSeconds(5));
 * }
 * }</pre>
 */
public final class WorkerPools {

    private static final Logger logger = LogManager.getLogger(WorkerPools.class);

    private WorkerPools() {
    }

    /**
     * Returns the default parallelism level: one worker per available processor.
     *
     * @return max(1, availableProcessors)
     */
    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates a fixed-size pool of named daemon threads.
     *
     * @param prefix thread name prefix
     * @param parallelism number of worker threads
     * @return a new executor
     * @throws IllegalArgumentException if parallelism is less than 1
     */
    public static ExecutorService newFixedPool(String prefix, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got: " + parallelism);
        }
        return Executors.newFixedThreadPool(parallelism, namedDaemonFactory(prefix));
    }

    static ThreadFactory namedDaemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Shuts a pool down, waiting up to {@code grace} for running tasks before
     * interrupting them.
     *
     * @param pool the pool to stop
     * @param grace how long to wait for running tasks
     * @return true if the pool terminated within the grace period
     */
    public static boolean shutdown(ExecutorService pool, Duration grace) {
        pool.shutdown();
        try {
            if (pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            List<Runnable> dropped = pool.shutdownNow();
            logger.warn("Worker pool did not terminate within {}; interrupted, {} queued tasks dropped",
                grace, dropped.size());
            return pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
