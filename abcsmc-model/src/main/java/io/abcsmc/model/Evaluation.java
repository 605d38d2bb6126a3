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

import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one proposal: the particle it produced and the number
 * of simulations that were consumed for it.
 *
 * <p>An evaluation is {@link #isExhausted() exhausted} when the per-particle
 * simulation cap was hit before the attempts budget was used up. Such an
 * evaluation carries an invalid particle and is always rejected.
 */
public final class Evaluation {

    private final Particle particle;
    private final long simulationCount;
    private final boolean exhausted;

    private Evaluation(Particle particle, long simulationCount, boolean exhausted) {
        if (simulationCount < 0) {
            throw new IllegalArgumentException("simulationCount must be >= 0, got: " + simulationCount);
        }
        this.particle = Objects.requireNonNull(particle, "particle");
        this.simulationCount = simulationCount;
        this.exhausted = exhausted;
    }

    public static Evaluation of(Particle particle, long simulationCount) {
        return new Evaluation(particle, simulationCount, false);
    }

    /**
     * @param modelIndex model of the dropped proposal
     * @param parameter parameter of the dropped proposal
     * @param simulationCount simulations consumed before the cap was hit
     * @return an exhausted evaluation with an empty particle
     */
    public static Evaluation exhausted(int modelIndex, Parameter parameter, long simulationCount) {
        Particle empty = new Particle(modelIndex, parameter, 0.0, List.of(), List.of());
        return new Evaluation(empty, simulationCount, true);
    }

    public int getModelIndex() {
        return particle.getModelIndex();
    }

    public Particle getParticle() {
        return particle;
    }

    public long getSimulationCount() {
        return simulationCount;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    Evaluation withWeight(double weight) {
        return new Evaluation(particle.withWeight(weight), simulationCount, exhausted);
    }

    @Override
    public String toString() {
        return "Evaluation{" + particle + ", simulations=" + simulationCount +
            (exhausted ? ", exhausted" : "") + '}';
    }
}
