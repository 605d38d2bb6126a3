package io.abcsmc.engine;

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

import io.abcsmc.engine.sampler.Sampler;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class AbcSmcOptionsTest {

    @Test
    void defaults() {
        AbcSmcOptions options = AbcSmcOptions.builder(100).build();
        assertEquals(100, options.getNrParticles());
        assertEquals(500, options.getMaxNrAllowedSampleAttemptsPerParticle());
        assertEquals(1, options.getMinNrParticlesPerPopulation());
        assertTrue(options.isStopIfOnlySingleModelAlive());
        assertEquals(Sampler.UNBOUNDED, options.getMaxNrEvaluationsPerGeneration());
        assertNull(options.getSeed());
        assertFalse(options.isShowProgress());
        assertFalse(options.isFailOnIncompleteGeneration());
    }

    @Test
    void loadsFromClasspathJson() throws IOException {
        AbcSmcOptions options;
        try (Reader reader = new InputStreamReader(
            getClass().getResourceAsStream("/options.json"), StandardCharsets.UTF_8)) {
            options = AbcSmcOptions.fromJson(reader);
        }
        assertEquals(250, options.getNrParticles());
        assertEquals(100, options.getMaxNrAllowedSampleAttemptsPerParticle());
        assertEquals(200, options.getMinNrParticlesPerPopulation());
        assertFalse(options.isStopIfOnlySingleModelAlive());
        assertEquals(100_000L, options.getMaxNrEvaluationsPerGeneration());
        assertEquals(42L, options.getSeed());
        assertTrue(options.isFailOnIncompleteGeneration());
    }

    @Test
    void absentFieldsTakeDefaults() {
        AbcSmcOptions options = AbcSmcOptions.fromJson("{\"nr_particles\": 10}");
        assertEquals(AbcSmcOptions.builder(10).build(), options);
    }

    @Test
    void savesAndLoadsTheSameOptions(@TempDir Path dir) throws IOException {
        AbcSmcOptions options = AbcSmcOptions.builder(64).seed(3L).minNrParticlesPerPopulation(32)
            .maxNrEvaluationsPerGeneration(1000).showProgress(true).build();
        Path file = dir.resolve("options.json");
        options.save(file);

        assertEquals(options, AbcSmcOptions.load(file));
        assertThat(options.toJson()).contains("\"nr_particles\": 64");
    }

    @Test
    void unboundedEvaluationsAreOmittedFromJson() {
        assertThat(AbcSmcOptions.builder(5).build().toJson()).doesNotContain("max_nr_evaluations_per_generation");
    }

    @Test
    void rejectsInvalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> AbcSmcOptions.builder(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> AbcSmcOptions.builder(10).minNrParticlesPerPopulation(11).build());
        assertThrows(IllegalArgumentException.class,
            () -> AbcSmcOptions.builder(10).maxNrAllowedSampleAttemptsPerParticle(0).build());
        assertThrows(IllegalArgumentException.class, () -> AbcSmcOptions.fromJson("{\"seed\": 1}"));
        IllegalArgumentException malformed = assertThrows(IllegalArgumentException.class,
            () -> AbcSmcOptions.fromJson("{\"nr_particles\": [}"));
        assertNotNull(malformed.getCause());
        assertThrows(IOException.class, () -> AbcSmcOptions.load(Path.of("does-not-exist.json")));
    }
}
