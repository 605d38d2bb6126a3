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

import io.abcsmc.model.Parameter;
import io.abcsmc.random.ModelPrior;
import io.abcsmc.random.ParameterPrior;
import io.abcsmc.random.transition.ModelPerturbationKernel;
import io.abcsmc.random.transition.Transition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Importance weight of an accepted particle.
///
/// With `f` the accepted fraction of the particle's simulations:
///
/// ```
///   t = 0:  w = f
///   t > 0:  w = modelPrior(m) · paramPrior[m](θ) · f
///               ─────────────────────────────────────────────────────
///               (Σ_j P_{t-1}(j) · K_model(m | j)) · fitted[m].pdf(θ)
/// ```
///
/// A zero denominator yields weight 0, as does a weight that overflows. Both are
/// logged and counted in [GenerationDiagnostics].
public abstract class ImportanceWeight {

    private static final Logger logger = LogManager.getLogger(ImportanceWeight.class);

    private static final ImportanceWeight PRIOR = new ImportanceWeight() {
        @Override
        public double weight(int model, Parameter parameter, double acceptedFraction,
                             GenerationDiagnostics diagnostics) {
            return acceptedFraction;
        }
    };

    private ImportanceWeight() {
    }

    /// @return the weighting of generation 0
    public static ImportanceWeight prior() {
        return PRIOR;
    }

    /// @param previousProbabilities model probabilities of generation `t-1`
    /// @param modelKernel model perturbation kernel
    /// @param fitted fitted parameter kernel per model, null for extinct models
    /// @param modelPrior model prior
    /// @param parameterPriors parameter prior per model
    /// @return the weighting of a generation after the first
    public static ImportanceWeight perturbed(double[] previousProbabilities, ModelPerturbationKernel modelKernel,
                                             List<Transition.Fitted> fitted, ModelPrior modelPrior,
                                             List<ParameterPrior> parameterPriors) {
        return new Perturbed(previousProbabilities, modelKernel, fitted, modelPrior, parameterPriors);
    }

    /// @param model model index of the particle
    /// @param parameter parameter of the particle
    /// @param acceptedFraction accepted simulations over the attempts budget
    /// @param diagnostics receives degenerate-weight events
    /// @return the unnormalized weight, finite and ≥ 0
    public abstract double weight(int model, Parameter parameter, double acceptedFraction,
                                  GenerationDiagnostics diagnostics);

    private static final class Perturbed extends ImportanceWeight {

        private final double[] previousProbabilities;
        private final ModelPerturbationKernel modelKernel;
        private final List<Transition.Fitted> fitted;
        private final ModelPrior modelPrior;
        private final List<ParameterPrior> parameterPriors;

        private Perturbed(double[] previousProbabilities, ModelPerturbationKernel modelKernel,
                          List<Transition.Fitted> fitted, ModelPrior modelPrior,
                          List<ParameterPrior> parameterPriors) {
            this.previousProbabilities = previousProbabilities.clone();
            this.modelKernel = modelKernel;
            this.fitted = Collections.unmodifiableList(new ArrayList<>(fitted));
            this.modelPrior = modelPrior;
            this.parameterPriors = List.copyOf(parameterPriors);
        }

        @Override
        public double weight(int model, Parameter parameter, double acceptedFraction,
                             GenerationDiagnostics diagnostics) {
            double modelFactor = 0.0;
            for (int j = 0; j < previousProbabilities.length; j++) {
                modelFactor += previousProbabilities[j] * modelKernel.pmf(model, j);
            }
            Transition.Fitted kernel = fitted.get(model);
            double particleFactor = kernel == null ? 0.0 : kernel.pdf(parameter);
            double normalization = modelFactor * particleFactor;
            if (normalization == 0.0) {
                diagnostics.recordZeroNormalization();
                logger.warn("Zero importance-weight normalization for model {} at {}, weight set to 0",
                    model, parameter);
                return 0.0;
            }
            double priorDensity = modelPrior.pmf(model) * parameterPriors.get(model).pdf(parameter);
            double weight = priorDensity * acceptedFraction / normalization;
            if (!Double.isFinite(weight) || weight < 0.0) {
                diagnostics.recordZeroNormalization();
                logger.warn("Importance weight {} for model {} at {} is not usable, weight set to 0",
                    weight, model, parameter);
                return 0.0;
            }
            return weight;
        }
    }
}
