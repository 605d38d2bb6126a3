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
import io.abcsmc.random.ModelPrior;
import io.abcsmc.random.ParameterPrior;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.List;
import java.util.Objects;

/**
 * Generation 0 proposal: the model from the model prior, then the parameter
 * from that model's parameter prior.
 */
public final class PriorProposal implements Proposal {

    private final ModelPrior modelPrior;
    private final List<ParameterPrior> parameterPriors;

    public PriorProposal(ModelPrior modelPrior, List<ParameterPrior> parameterPriors) {
        this.modelPrior = Objects.requireNonNull(modelPrior, "modelPrior");
        this.parameterPriors = List.copyOf(parameterPriors);
        if (modelPrior.size() != this.parameterPriors.size()) {
            throw new IllegalArgumentException("Model prior covers " + modelPrior.size()
                + " models but " + this.parameterPriors.size() + " parameter priors were given");
        }
    }

    @Override
    public Candidate propose(UniformRandomProvider rng) {
        int model = modelPrior.rvs(rng);
        return new Candidate(model, parameterPriors.get(model).rvs(rng));
    }
}
