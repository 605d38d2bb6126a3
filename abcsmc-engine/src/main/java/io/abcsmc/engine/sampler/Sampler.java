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
import io.abcsmc.model.SampleFactory;
import io.abcsmc.status.eventing.StatusSink;
import io.abcsmc.status.exec.EvaluationStatistics;
import io.abcsmc.status.sinks.LoggerStatusSink;
import io.abcsmc.status.sinks.NoopStatusSink;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/// Fulfils "produce n accepted particles" for the engine.
///
/// The sampler is a fixed adapter around a pluggable [SamplingStrategy]. Every
/// strategy's output passes through the same [SampleValidator], so the output
/// guarantees do not depend on which strategy is plugged in:
///
/// ```
///   sampleUntilNAccepted(n, proposal, evaluator, acceptor, ...)
///        │
///        ▼
///   SamplingStrategy.sample(task)   ── raw sample
///        │
///        ▼
///   SampleValidator.validate        ── count / preliminary checks, normalization
///        │
///        ▼
///   Sample (weights sum to 1, exactly n accepted unless degraded)
/// ```
///
/// ## Thread Safety
///
/// One sampling call at a time. [#stop()] may be called from any thread. It
/// makes the running call, and every later call, return a degraded sample
/// until [#clearStop()] is called.
public final class Sampler {

    private static final Logger logger = LogManager.getLogger(Sampler.class);

    public static final long UNBOUNDED = Long.MAX_VALUE;

    private final SamplingStrategy strategy;
    private final SampleFactory sampleFactory;
    private final SampleValidator validator = new SampleValidator();
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    private volatile StatusSink statusSink = NoopStatusSink.getInstance();
    private volatile boolean showProgress;
    private volatile String analysisId = "abcsmc";
    private volatile long nrEvaluations;
    private volatile EvaluationStatistics lastStatistics = new EvaluationStatistics();

    public Sampler(SamplingStrategy strategy) {
        this(strategy, new SampleFactory(false));
    }

    public Sampler(SamplingStrategy strategy, SampleFactory sampleFactory) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.sampleFactory = Objects.requireNonNull(sampleFactory, "sampleFactory");
    }

    public static Sampler singleCore() {
        return new Sampler(new SingleCoreStrategy());
    }

    /// Samples until `n` evaluations are accepted, the evaluation budget is
    /// spent, or [#stop()] is called.
    ///
    /// @param n number of accepted particles requested, at least 1
    /// @param proposal draws candidates
    /// @param evaluator evaluates candidates
    /// @param acceptor accepts evaluations
    /// @param t generation index, used for progress naming only
    /// @param maxEval maximum evaluations for this call, [#UNBOUNDED] for no limit
    /// @param allAccepted accept every evaluation
    /// @param rng master random source; strategies derive worker sources from it
    /// @return a validated, normalized sample
    /// @throws IllegalStateException if the strategy breaks the output contract
    public Sample sampleUntilNAccepted(int n, Proposal proposal, Evaluator evaluator, Acceptor acceptor,
                                       int t, long maxEval, boolean allAccepted, UniformRandomProvider rng) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1, got: " + n);
        }
        if (maxEval < 1) {
            throw new IllegalArgumentException("maxEval must be >= 1, got: " + maxEval);
        }
        EvaluationStatistics statistics = new EvaluationStatistics();
        lastStatistics = statistics;
        String taskName = analysisId + (t >= 0 ? " t=" + t : " prior");
        SamplingTask task = new SamplingTask(n,
            Objects.requireNonNull(proposal, "proposal"),
            Objects.requireNonNull(evaluator, "evaluator"),
            Objects.requireNonNull(acceptor, "acceptor"),
            maxEval, allAccepted, Objects.requireNonNull(rng, "rng"),
            sampleFactory, statistics,
            showProgress ? statusSink : NoopStatusSink.getInstance(),
            taskName, stopRequested);

        Sample sample = strategy.sample(task);
        nrEvaluations = sample.getNrEvaluations();
        if (!sample.isOk()) {
            logger.warn("{}: {} returned a degraded sample with {}/{} accepted: {}",
                taskName, strategy.name(), sample.getNrAccepted(), n, sample.getDegradedReason());
        }
        logger.debug("{}: {} {}", taskName, strategy.name(), statistics);
        return validator.validate(sample, n, strategy.name());
    }

    /// @return evaluations consumed by the last call
    public long getNrEvaluations() {
        return nrEvaluations;
    }

    /// @return live counters of the current or last call
    public EvaluationStatistics getLastStatistics() {
        return lastStatistics;
    }

    /// Enables progress reporting. With no sink set, progress goes to a
    /// [LoggerStatusSink].
    public void setShowProgress(boolean showProgress) {
        this.showProgress = showProgress;
        if (showProgress && statusSink instanceof NoopStatusSink) {
            statusSink = new LoggerStatusSink();
        }
    }

    public boolean isShowProgress() {
        return showProgress;
    }

    public void setStatusSink(StatusSink statusSink) {
        this.statusSink = Objects.requireNonNull(statusSink, "statusSink");
    }

    public void setAnalysisId(String analysisId) {
        this.analysisId = Objects.requireNonNull(analysisId, "analysisId");
    }

    public SamplingStrategy getStrategy() {
        return strategy;
    }

    /// Asks the running call to return early with a degraded sample.
    public void stop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /// Withdraws a stop request so that the next call samples normally.
    public void clearStop() {
        stopRequested.set(false);
    }
}
