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
import io.abcsmc.random.RandomSources;
import io.abcsmc.status.exec.WorkerPools;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps {@code n} independent jobs over a fixed worker pool. Each job proposes
 * and evaluates until one evaluation is accepted.
 *
 * <pre>{@code
 *   job 0:  reject reject accept ─┐
 *   job 1:  accept ───────────────┤ consolidated in job order
 *   ...                           │
 *   job n-1: reject accept ───────┘
 * }</pre>
 *
 * <p>Each job gets its own random source, derived from the master before any
 * job starts, so with an unbounded evaluation budget the sample is identical
 * for a given seed regardless of thread timing. A bounded budget is shared by
 * all jobs through an atomic counter that is checked before each evaluation.
 */
public final class MappingStrategy implements SamplingStrategy {

    private static final Logger logger = LogManager.getLogger(MappingStrategy.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final int parallelism;

    public MappingStrategy() {
        this(WorkerPools.defaultParallelism());
    }

    /**
     * @param parallelism number of worker threads
     * @throws IllegalArgumentException if parallelism is below 1
     */
    public MappingStrategy(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public int getParallelism() {
        return parallelism;
    }

    private record JobResult(List<Outcome> outcomes) {
    }

    @Override
    public Sample sample(SamplingTask task) {
        Sample sample = task.newSample();
        task.started();

        List<UniformRandomProvider> jobRngs = new ArrayList<>(task.n());
        for (int i = 0; i < task.n(); i++) {
            jobRngs.add(RandomSources.split(task.rng()));
        }
        AtomicLong budget = new AtomicLong();
        ExecutorService pool = WorkerPools.newFixedPool("abcsmc-map", parallelism);
        List<Future<JobResult>> futures = new ArrayList<>(task.n());
        try {
            for (UniformRandomProvider jobRng : jobRngs) {
                futures.add(pool.submit(() -> runJob(task, jobRng, budget)));
            }
            for (Future<JobResult> future : futures) {
                for (Outcome outcome : future.get().outcomes()) {
                    outcome.appendTo(sample);
                    if (outcome.accepted()) {
                        task.progress();
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sample.markDegraded("interrupted");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw new IllegalStateException("Sampling job failed", e.getCause());
        } finally {
            for (Future<JobResult> future : futures) {
                if (future.cancel(true)) {
                    task.statistics().incrementCancelled();
                }
            }
            if (!WorkerPools.shutdown(pool, SHUTDOWN_GRACE)) {
                logger.warn("Mapping pool did not terminate within {}", SHUTDOWN_GRACE);
            }
        }

        if (sample.isOk() && sample.getNrAccepted() < task.n()) {
            sample.markDegraded(task.isStopRequested()
                ? "stop requested"
                : "evaluation budget of " + task.maxEval() + " exhausted");
        }
        task.finished(sample);
        return sample;
    }

    private static JobResult runJob(SamplingTask task, UniformRandomProvider rng, AtomicLong budget) {
        List<Outcome> outcomes = new ArrayList<>();
        while (!task.isStopRequested() && budget.incrementAndGet() <= task.maxEval()) {
            Outcome outcome = task.evaluateOne(rng);
            outcomes.add(outcome);
            if (outcome.accepted()) {
                break;
            }
        }
        return new JobResult(outcomes);
    }
}
