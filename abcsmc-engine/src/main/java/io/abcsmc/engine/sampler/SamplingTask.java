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

import io.abcsmc.model.Evaluation;
import io.abcsmc.model.Sample;
import io.abcsmc.model.SampleFactory;
import io.abcsmc.status.eventing.RunState;
import io.abcsmc.status.eventing.StatusSink;
import io.abcsmc.status.exec.EvaluationStatistics;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything a {@link SamplingStrategy} needs for one "sample until n accepted"
 * call. Built by {@link Sampler}; strategies only read it.
 *
 * @param n number of accepted particles requested
 * @param proposal generation-bound proposal
 * @param evaluator generation-bound evaluator
 * @param acceptor acceptance predicate
 * @param maxEval maximum number of evaluations, {@link Long#MAX_VALUE} for unbounded
 * @param allAccepted accept every evaluation without consulting the acceptor
 * @param rng master random source, used only on the calling thread
 * @param sampleFactory creates the result sample
 * @param statistics live counters, updated from workers
 * @param statusSink progress receiver
 * @param taskName name used for progress and logging
 * @param stopRequested set when the sampler is asked to stop
 */
public record SamplingTask(int n,
                           Proposal proposal,
                           Evaluator evaluator,
                           Acceptor acceptor,
                           long maxEval,
                           boolean allAccepted,
                           UniformRandomProvider rng,
                           SampleFactory sampleFactory,
                           EvaluationStatistics statistics,
                           StatusSink statusSink,
                           String taskName,
                           AtomicBoolean stopRequested) {

    private static final Logger logger = LogManager.getLogger(SamplingTask.class);

    /**
     * Runs one propose/evaluate/accept cycle. Runtime exceptions are isolated
     * to this cycle and reported as a failed outcome; errors propagate.
     *
     * @param workerRng random source owned by the calling thread
     * @return the outcome
     */
    public Outcome evaluateOne(UniformRandomProvider workerRng) {
        statistics.incrementSubmitted();
        try {
            Candidate candidate = proposal.propose(workerRng);
            Evaluation evaluation = evaluator.evaluate(candidate, workerRng);
            boolean accepted = allAccepted || acceptor.accept(evaluation);
            statistics.recordCompleted(accepted);
            return Outcome.of(evaluation, accepted);
        } catch (RuntimeException e) {
            statistics.incrementFailed();
            logger.warn("Evaluation failed in {}: {}", taskName, e.toString(), e);
            return Outcome.failed(e);
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public Sample newSample() {
        return sampleFactory.newSample();
    }

    void started() {
        statusSink.taskStarted(taskName, n);
    }

    void progress() {
        statusSink.taskUpdate(taskName, statistics.snapshot(RunState.RUNNING, n));
    }

    void finished(Sample sample) {
        RunState state;
        if (sample.isOk()) {
            state = RunState.SUCCESS;
        } else if (isStopRequested()) {
            state = RunState.CANCELLED;
        } else {
            state = RunState.DEGRADED;
        }
        statusSink.taskFinished(taskName, statistics.snapshot(state, n));
    }
}
