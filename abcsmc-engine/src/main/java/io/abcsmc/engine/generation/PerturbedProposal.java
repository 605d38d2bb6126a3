package io.abcsmc.engine.generation;

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

import io.abcsmc.engine.sampler.Candidate;
import io.abcsmc.engine.sampler.Proposal;
import io.abcsmc.model.Parameter;
import io.abcsmc.random.ModelPrior;
import io.abcsmc.random.ParameterPrior;
import io.abcsmc.random.RandomSources;
import io.abcsmc.random.transition.ModelPerturbationKernel;
import io.abcsmc.random.transition.Transition;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Proposal for generations after the first.
///
/// ```
///   source m  ~ P_{t-1}
///   target m' ~ K_model(· | m)        retry if m' is extinct
///   θ'        ~ fitted[m'].rvs()
///   retry the whole draw while modelPrior(m') · paramPrior[m'](θ') == 0
/// ```
///
/// A model is extinct when it has zero probability in the previous generation
/// or no fitted kernel. Extinct models are never returned as targets.
///
/// The retry loop is bounded by [#DEFAULT_MAX_ATTEMPTS]; running out throws
/// [IllegalStateException], which the sampler counts as a failed evaluation.
public final class PerturbedProposal implements Proposal {

    public static final int DEFAULT_MAX_ATTEMPTS = 100_000;

    private final double[] previousProbabilities;
    private final double[] cumulative;
    private final ModelPerturbationKernel modelKernel;
    private final List<Transition.Fitted> fitted;
    private final ModelPrior modelPrior;
    private final List<ParameterPrior> parameterPriors;
    private final int maxAttempts;

    /// @param previousProbabilities model probabilities of generation `t-1`
    /// @param modelKernel model perturbation kernel
    /// @param fitted fitted parameter kernel per model, null for extinct models
    /// @param modelPrior model prior
    /// @param parameterPriors parameter prior per model
    public PerturbedProposal(double[] previousProbabilities, ModelPerturbationKernel modelKernel,
                             List<Transition.Fitted> fitted, ModelPrior modelPrior,
                             List<ParameterPrior> parameterPriors) {
        this(previousProbabilities, modelKernel, fitted, modelPrior, parameterPriors, DEFAULT_MAX_ATTEMPTS);
    }

    public PerturbedProposal(double[] previousProbabilities, ModelPerturbationKernel modelKernel,
                             List<Transition.Fitted> fitted, ModelPrior modelPrior,
                             List<ParameterPrior> parameterPriors, int maxAttempts) {
        this.previousProbabilities = previousProbabilities.clone();
        this.modelKernel = Objects.requireNonNull(modelKernel, "modelKernel");
        this.fitted = Collections.unmodifiableList(new ArrayList<>(fitted));
        this.modelPrior = Objects.requireNonNull(modelPrior, "modelPrior");
        this.parameterPriors = List.copyOf(parameterPriors);
        int nrModels = this.previousProbabilities.length;
        if (this.fitted.size() != nrModels || this.parameterPriors.size() != nrModels
            || modelKernel.getNrModels() != nrModels) {
            throw new IllegalArgumentException("Inconsistent model counts: probabilities=" + nrModels
                + ", kernels=" + this.fitted.size() + ", priors=" + this.parameterPriors.size()
                + ", model kernel=" + modelKernel.getNrModels());
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        boolean anyAlive = false;
        for (int m = 0; m < nrModels; m++) {
            anyAlive |= isAlive(m);
        }
        if (!anyAlive) {
            throw new IllegalArgumentException("No model is alive in the previous generation");
        }
        this.cumulative = RandomSources.cumulative(this.previousProbabilities);
        this.maxAttempts = maxAttempts;
    }

    public boolean isAlive(int model) {
        return previousProbabilities[model] > 0.0 && fitted.get(model) != null;
    }

    @Override
    public Candidate propose(UniformRandomProvider rng) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int source = RandomSources.sampleIndex(cumulative, rng);
            int target = modelKernel.rvs(source, rng);
            if (!isAlive(target)) {
                continue;
            }
            Parameter parameter = fitted.get(target).rvs(rng);
            if (modelPrior.pmf(target) * parameterPriors.get(target).pdf(parameter) > 0.0) {
                return new Candidate(target, parameter);
            }
        }
        throw new IllegalStateException("No proposal with positive prior density after " + maxAttempts + " attempts");
    }
}
