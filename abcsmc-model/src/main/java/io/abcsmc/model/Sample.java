package io.abcsmc.model;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw output of one sampler call for one generation.
 *
 * <p>Accepted evaluations are kept in the order they were accepted; rejected
 * evaluations are kept only when the sample was created with
 * {@code recordRejected}. Counters cover every evaluation, recorded or not.
 *
 * <h2>Degraded samples</h2>
 *
 * <p>A sample that stopped before reaching its target, for example because the
 * generation's evaluation budget ran out, is marked with
 * {@link #markDegraded(String)}. Such a sample is not {@link #isOk() ok} and
 * may hold fewer accepted particles than requested.
 *
 * <p>Not thread-safe. Sampling strategies consolidate results on the calling
 * thread.
 */
public final class Sample {

    private static final Logger logger = LogManager.getLogger(Sample.class);

    private final boolean recordRejected;
    private final List<Evaluation> accepted = new ArrayList<>();
    private final List<Evaluation> rejected = new ArrayList<>();
    private long nrEvaluations;
    private long nrSimulations;
    private long nrFailedEvaluations;
    private String degradedReason;
    private boolean normalized;

    Sample(boolean recordRejected) {
        this.recordRejected = recordRejected;
    }

    /**
     * Records one completed evaluation.
     *
     * @param evaluation the outcome
     * @param isAccepted whether the acceptor accepted it
     */
    public void append(Evaluation evaluation, boolean isAccepted) {
        if (normalized) {
            throw new IllegalStateException("Sample is already normalized");
        }
        nrEvaluations++;
        nrSimulations += evaluation.getSimulationCount();
        if (isAccepted) {
            accepted.add(evaluation);
        } else if (recordRejected) {
            rejected.add(evaluation);
        }
    }

    /**
     * Records an evaluation that threw instead of returning. It counts toward
     * the evaluation total and is treated as rejected.
     */
    public void recordFailedEvaluation() {
        nrEvaluations++;
        nrFailedEvaluations++;
    }

    /**
     * Flags this sample as incomplete.
     *
     * @param reason human readable reason, kept for reporting
     */
    public void markDegraded(String reason) {
        this.degradedReason = reason;
    }

    public boolean isOk() {
        return degradedReason == null;
    }

    /**
     * @return the degradation reason, or null if the sample is ok
     */
    public String getDegradedReason() {
        return degradedReason;
    }

    public boolean isRecordRejected() {
        return recordRejected;
    }

    public List<Evaluation> getAccepted() {
        return Collections.unmodifiableList(accepted);
    }

    public List<Evaluation> getRejected() {
        return Collections.unmodifiableList(rejected);
    }

    public int getNrAccepted() {
        return accepted.size();
    }

    /**
     * @return the accepted particles, in acceptance order
     */
    public List<Particle> getAcceptedParticles() {
        List<Particle> particles = new ArrayList<>(accepted.size());
        for (Evaluation evaluation : accepted) {
            particles.add(evaluation.getParticle());
        }
        return particles;
    }

    /**
     * @return number of propose/evaluate cycles consumed, failed ones included
     */
    public long getNrEvaluations() {
        return nrEvaluations;
    }

    public long getNrSimulations() {
        return nrSimulations;
    }

    public long getNrFailedEvaluations() {
        return nrFailedEvaluations;
    }

    public boolean isNormalized() {
        return normalized;
    }

    /**
     * Scales accepted weights to sum to one. Runs at most once; later calls
     * are no-ops. When the total weight is zero the weights are left at zero
     * and a warning is logged.
     */
    public void normalizeWeights() {
        if (normalized) {
            return;
        }
        normalized = true;
        double total = 0.0;
        for (Evaluation evaluation : accepted) {
            total += evaluation.getParticle().getWeight();
        }
        if (!(total > 0.0)) {
            if (!accepted.isEmpty()) {
                logger.warn("Total weight of {} accepted particles is {}, weights left unnormalized",
                    accepted.size(), total);
            }
            return;
        }
        for (int i = 0; i < accepted.size(); i++) {
            Evaluation evaluation = accepted.get(i);
            accepted.set(i, evaluation.withWeight(evaluation.getParticle().getWeight() / total));
        }
    }

    @Override
    public String toString() {
        return "Sample{accepted=" + accepted.size() +
            ", evaluations=" + nrEvaluations +
            ", simulations=" + nrSimulations +
            (isOk() ? "" : ", degraded='" + degradedReason + "'") +
            '}';
    }
}
