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
import io.abcsmc.model.scalar.UniformScalarModel;
import io.abcsmc.random.ModelPrior;
import io.abcsmc.random.ParameterPrior;
import io.abcsmc.random.transition.ModelPerturbationKernel;
import io.abcsmc.random.transition.Transition;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ImportanceWeightTest {

    private static final ParameterPrior UNIT = ParameterPrior.builder().add("x", new UniformScalarModel(0.0, 1.0)).build();
    private static final List<ParameterPrior> PRIORS = List.of(UNIT, UNIT);

    @Test
    void priorWeightIsTheAcceptedFraction() {
        GenerationDiagnostics diagnostics = new GenerationDiagnostics();
        assertEquals(0.25, ImportanceWeight.prior().weight(1, Parameter.of("x", 0.3), 0.25, diagnostics));
        assertEquals(0, diagnostics.getZeroNormalizationEvents());
    }

    @Test
    void perturbedWeightCorrectsForTheProposal() {
        // model factor for m=0: 0.5·0.7 + 0.5·0.3 = 0.5; kernel density 2 ⇒ normalization 1
        List<Transition.Fitted> fitted = List.of(KernelStubs.fixed(0.5, 2.0), KernelStubs.fixed(0.5, 2.0));
        ImportanceWeight weighting = ImportanceWeight.perturbed(new double[]{0.5, 0.5},
            new ModelPerturbationKernel(2), fitted, ModelPrior.uniform(2), PRIORS);
        GenerationDiagnostics diagnostics = new GenerationDiagnostics();

        assertEquals(0.5, weighting.weight(0, Parameter.of("x", 0.5), 1.0, diagnostics), 1e-12);
        assertEquals(0.25, weighting.weight(0, Parameter.of("x", 0.5), 0.5, diagnostics), 1e-12);
        assertEquals(0, diagnostics.getZeroNormalizationEvents());
    }

    @Test
    void zeroNormalizationGivesWeightZeroAndIsCounted() {
        List<Transition.Fitted> fitted = Arrays.asList(KernelStubs.fixed(0.5, 0.0), null);
        ImportanceWeight weighting = ImportanceWeight.perturbed(new double[]{1.0, 0.0},
            new ModelPerturbationKernel(2), fitted, ModelPrior.uniform(2), PRIORS);
        GenerationDiagnostics diagnostics = new GenerationDiagnostics();

        assertEquals(0.0, weighting.weight(0, Parameter.of("x", 0.5), 1.0, diagnostics));
        assertEquals(0.0, weighting.weight(1, Parameter.of("x", 0.5), 1.0, diagnostics));
        assertEquals(2, diagnostics.getZeroNormalizationEvents());
    }

    @Test
    void weightOutsideThePriorIsZeroWithoutDiagnostic() {
        List<Transition.Fitted> fitted = List.of(KernelStubs.fixed(0.5, 1.0), KernelStubs.fixed(0.5, 1.0));
        ImportanceWeight weighting = ImportanceWeight.perturbed(new double[]{0.5, 0.5},
            new ModelPerturbationKernel(2), fitted, ModelPrior.uniform(2), PRIORS);
        GenerationDiagnostics diagnostics = new GenerationDiagnostics();

        assertEquals(0.0, weighting.weight(0, Parameter.of("x", 3.0), 1.0, diagnostics));
        assertEquals(0, diagnostics.getZeroNormalizationEvents());
    }
}
