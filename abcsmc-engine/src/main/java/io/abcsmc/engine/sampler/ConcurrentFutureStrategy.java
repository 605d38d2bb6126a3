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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dynamic scheduling with speculative look-ahead.
 *
 * <h2>Scheduling</h2>
 *
 * <pre>{@code
 *   submit ──► [batch 0][batch 1] ... [batch p-1]     p = parallelism
 *                 │
 *   consume in submission order, refill one batch per consumed batch
 *                 │
 *   stop at n accepted or when the evaluation budget is submitted,
 *   then cancel everything still in flight
 * }</pre>
 *
 * <p>Results are consolidated strictly in submission order. Outcomes after the
 * n-th acceptance are discarded, so the population is formed by the earliest
 * submitted acceptances rather than by the fastest simulations. Each batch
 * runs on its own random source derived from the master at submission time,
 * which makes the sample reproducible for a given seed.
 *
 * <h2>Adaptive batch size</h2>
 *
 * <p>With adaptive batching the batch size is re-estimated after each
 * consumed batch from the observed acceptance rate, so that the batches in
 * flight are expected to cover the acceptances still missing. The size stays
 * within {@code [1, maxBatchSize]}.
 *
 * <h2>Evaluation counts</h2>
 *
 * <p>{@link Sample#getNrEvaluations()} covers consolidated outcomes only;
 * discarded and cancelled work shows up in the sampler's
 * {@link io.abcsmc.status.exec.EvaluationStatistics}. The budget bounds the
 * number of submitted evaluations and never interrupts a running one.
 */
public final class ConcurrentFutureStrategy implements SamplingStrategy {

    private static final Logger logger = LogManager.getLogger(ConcurrentFutureStrategy.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final int parallelism;
    private final int batchSize;
    private final boolean adaptiveBatchSize;
    private final int maxBatchSize;

    private ConcurrentFutureStrategy(Builder builder) {
        this.parallelism = builder.parallelism;
        this.batchSize = builder.batchSize;
        this.adaptiveBatchSize = builder.adaptiveBatchSize;
        this.maxBatchSize = builder.maxBatchSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isAdaptiveBatchSize() {
        return adaptiveBatchSize;
    }

    @Override
    public Sample sample(SamplingTask task) {
        Sample sample = task.newSample();
        task.started();

        ExecutorService pool = WorkerPools.newFixedPool("abcsmc-future", parallelism);
        Deque<Future<List<Outcome>>> inFlight = new ArrayDeque<>();
        AtomicBoolean done = new AtomicBoolean();
        long submitted = 0;
        int currentBatch = batchSize;
        long discarded = 0;
        try {
            while (sample.getNrAccepted() < task.n()) {
                if (task.isStopRequested()) {
                    sample.markDegraded("stop requested");
                    break;
                }
                while (inFlight.size() < parallelism && submitted < task.maxEval()) {
                    int size = (int) Math.min(currentBatch, task.maxEval() - submitted);
                    UniformRandomProvider batchRng = RandomSources.split(task.rng());
                    inFlight.addLast(pool.submit(() -> runBatch(task, batchRng, size, done)));
                    submitted += size;
                }
                if (inFlight.isEmpty()) {
                    sample.markDegraded("evaluation budget of " + task.maxEval() + " exhausted");
                    break;
                }
                for (Outcome outcome : inFlight.pollFirst().get()) {
                    if (sample.getNrAccepted() >= task.n()) {
                        discarded++;
                        continue;
                    }
                    outcome.appendTo(sample);
                    if (outcome.accepted()) {
                        task.progress();
                    }
                }
                if (adaptiveBatchSize) {
                    currentBatch = adaptBatchSize(sample, task.n());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sample.markDegraded("interrupted");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw new IllegalStateException("Sampling batch failed", e.getCause());
        } finally {
            done.set(true);
            for (Future<List<Outcome>> future : inFlight) {
                if (future.cancel(true)) {
                    task.statistics().incrementCancelled();
                }
            }
            if (!WorkerPools.shutdown(pool, SHUTDOWN_GRACE)) {
                logger.warn("Future pool did not terminate within {}", SHUTDOWN_GRACE);
            }
        }
        if (discarded > 0) {
            logger.debug("{}: discarded {} outcomes after reaching {} acceptances",
                task.taskName(), discarded, task.n());
        }
        task.finished(sample);
        return sample;
    }

    int adaptBatchSize(Sample sample, int n) {
        long evaluated = sample.getNrEvaluations();
        int accepted = sample.getNrAccepted();
        if (evaluated == 0 || accepted == 0) {
            return maxBatchSize;
        }
        double rate = accepted / (double) evaluated;
        double missing = n - accepted;
        long estimate = (long) Math.ceil(missing / (rate * parallelism));
        return (int) Math.max(1, Math.min(maxBatchSize, estimate));
    }

    private static List<Outcome> runBatch(SamplingTask task, UniformRandomProvider rng, int size,
                                          AtomicBoolean done) {
        List<Outcome> outcomes = new ArrayList<>(size);
        for (int i = 0; i < size && !done.get() && !task.isStopRequested(); i++) {
            outcomes.add(task.evaluateOne(rng));
        }
        return outcomes;
    }

    public static final class Builder {
        private int parallelism = WorkerPools.defaultParallelism();
        private int batchSize = 1;
        private boolean adaptiveBatchSize = false;
        private int maxBatchSize = 64;

        private Builder() {
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("Parallelism must be >= 1, got: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * @param batchSize evaluations per submitted task, also the initial size when adaptive
         */
        public Builder batchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("Batch size must be >= 1, got: " + batchSize);
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder adaptiveBatchSize(boolean adaptive) {
            this.adaptiveBatchSize = adaptive;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize < 1) {
                throw new IllegalArgumentException("Max batch size must be >= 1, got: " + maxBatchSize);
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public ConcurrentFutureStrategy build() {
            if (batchSize > maxBatchSize) {
                throw new IllegalArgumentException(
                    "Batch size " + batchSize + " exceeds max batch size " + maxBatchSize);
            }
            return new ConcurrentFutureStrategy(this);
        }
    }
}
