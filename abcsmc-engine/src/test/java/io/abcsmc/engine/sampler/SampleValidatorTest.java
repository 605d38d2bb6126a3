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
import io.abcsmc.model.Parameter;
import io.abcsmc.model.Particle;
import io.abcsmc.model.Sample;
import io.abcsmc.model.SampleFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SampleValidatorTest {

    private final SampleValidator validator = new SampleValidator();

    private static Evaluation accepted(double weight) {
        return Evaluation.of(new Particle(0, Parameter.of("a", weight), weight, List.of(0.5), List.of(Map.of())), 1);
    }

    @Test
    void normalizesAValidSample() {
        Sample sample = new SampleFactory().newSample();
        sample.append(accepted(2.0), true);
        sample.append(accepted(6.0), true);

        validator.validate(sample, 2, "test");

        assertTrue(sample.isNormalized());
        assertEquals(0.25, sample.getAcceptedParticles().get(0).getWeight(), 1e-12);
    }

    @Test
    void okSampleWithWrongCountIsRejected() {
        Sample sample = new SampleFactory().newSample();
        sample.append(accepted(1.0), true);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validate(sample, 3, "broken"));
        assertTrue(e.getMessage().startsWith("broken"));
    }

    @Test
    void degradedSampleMayBeShortButNotOver() {
        Sample shortSample = new SampleFactory().newSample();
        shortSample.append(accepted(1.0), true);
        shortSample.markDegraded("budget");
        assertSame(shortSample, validator.validate(shortSample, 3, "test"));

        Sample overfull = new SampleFactory().newSample();
        overfull.append(accepted(1.0), true);
        overfull.append(accepted(1.0), true);
        overfull.markDegraded("budget");
        assertThrows(IllegalStateException.class, () -> validator.validate(overfull, 1, "test"));
    }

    @Test
    void preliminaryParticlesAreRejected() {
        Sample sample = new SampleFactory().newSample();
        sample.append(Evaluation.of(Particle.preliminary(0, Parameter.of("a", 1.0)), 0), true);
        assertThrows(IllegalStateException.class, () -> validator.validate(sample, 1, "lookahead"));
    }
}
