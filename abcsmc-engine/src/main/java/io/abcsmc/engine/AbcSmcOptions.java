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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.abcsmc.engine.sampler.Sampler;
import io.abcsmc.model.json.AbcGsonConfig;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Run options of {@link AbcSmc}.
 *
 * <p>Built with {@link #builder(int)} or loaded from JSON. Field names in JSON
 * are snake_case:
 *
 * <pre>{@code
 * {
 *   "nr_particles": 500,
 *   "max_nr_allowed_sample_attempts_per_particle": 500,
 *   "min_nr_particles_per_population": 1,
 *   "stop_if_only_single_model_alive": true,
 *   "max_nr_evaluations_per_generation": 100000,
 *   "seed": 42,
 *   "show_progress": false,
 *   "fail_on_incomplete_generation": false
 * }
 * }</pre>
 *
 * <p>Only {@code nr_particles} is required; absent fields take their defaults,
 * an absent {@code max_nr_evaluations_per_generation} means unbounded, and an
 * absent {@code seed} means a fresh random seed per run.
 */
public final class AbcSmcOptions {

    public static final int DEFAULT_MAX_ATTEMPTS_PER_PARTICLE = 500;
    public static final int DEFAULT_MIN_NR_PARTICLES = 1;

    private final int nrParticles;
    private final int maxNrAllowedSampleAttemptsPerParticle;
    private final int minNrParticlesPerPopulation;
    private final boolean stopIfOnlySingleModelAlive;
    private final long maxNrEvaluationsPerGeneration;
    private final Long seed;
    private final boolean showProgress;
    private final boolean failOnIncompleteGeneration;

    private AbcSmcOptions(Builder builder) {
        if (builder.nrParticles < 1) {
            throw new IllegalArgumentException("nr_particles must be >= 1, got: " + builder.nrParticles);
        }
        if (builder.maxNrAllowedSampleAttemptsPerParticle < 1) {
            throw new IllegalArgumentException("max_nr_allowed_sample_attempts_per_particle must be >= 1, got: "
                + builder.maxNrAllowedSampleAttemptsPerParticle);
        }
        if (builder.minNrParticlesPerPopulation < 1 || builder.minNrParticlesPerPopulation > builder.nrParticles) {
            throw new IllegalArgumentException("min_nr_particles_per_population must be in [1, "
                + builder.nrParticles + "], got: " + builder.minNrParticlesPerPopulation);
        }
        if (builder.maxNrEvaluationsPerGeneration < 1) {
            throw new IllegalArgumentException("max_nr_evaluations_per_generation must be >= 1, got: "
                + builder.maxNrEvaluationsPerGeneration);
        }
        this.nrParticles = builder.nrParticles;
        this.maxNrAllowedSampleAttemptsPerParticle = builder.maxNrAllowedSampleAttemptsPerParticle;
        this.minNrParticlesPerPopulation = builder.minNrParticlesPerPopulation;
        this.stopIfOnlySingleModelAlive = builder.stopIfOnlySingleModelAlive;
        this.maxNrEvaluationsPerGeneration = builder.maxNrEvaluationsPerGeneration;
        this.seed = builder.seed;
        this.showProgress = builder.showProgress;
        this.failOnIncompleteGeneration = builder.failOnIncompleteGeneration;
    }

    /**
     * @param nrParticles particles per population
     * @return a builder with defaults for everything else
     */
    public static Builder builder(int nrParticles) {
        return new Builder(nrParticles);
    }

    public Builder toBuilder() {
        return new Builder(nrParticles)
            .maxNrAllowedSampleAttemptsPerParticle(maxNrAllowedSampleAttemptsPerParticle)
            .minNrParticlesPerPopulation(minNrParticlesPerPopulation)
            .stopIfOnlySingleModelAlive(stopIfOnlySingleModelAlive)
            .maxNrEvaluationsPerGeneration(maxNrEvaluationsPerGeneration)
            .seed(seed)
            .showProgress(showProgress)
            .failOnIncompleteGeneration(failOnIncompleteGeneration);
    }

    /**
     * @param json the options document
     * @return the parsed options
     * @throws IllegalArgumentException if the JSON is malformed or a value is invalid
     */
    public static AbcSmcOptions fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return fromFile(gson().fromJson(json, OptionsFile.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed options JSON: " + e.getMessage(), e);
        }
    }

    public static AbcSmcOptions fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader");
        try {
            return fromFile(gson().fromJson(reader, OptionsFile.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed options JSON: " + e.getMessage(), e);
        }
    }

    /**
     * @param path options file
     * @return the parsed options
     * @throws IOException if the file cannot be read
     */
    public static AbcSmcOptions load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    public String toJson() {
        return gson().toJson(toFile());
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson().toJson(toFile(), writer);
        }
    }

    /**
     * @return the options as flat strings, for run metadata
     */
    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("nr_particles", Integer.toString(nrParticles));
        metadata.put("max_nr_allowed_sample_attempts_per_particle", Integer.toString(maxNrAllowedSampleAttemptsPerParticle));
        metadata.put("min_nr_particles_per_population", Integer.toString(minNrParticlesPerPopulation));
        metadata.put("stop_if_only_single_model_alive", Boolean.toString(stopIfOnlySingleModelAlive));
        if (maxNrEvaluationsPerGeneration != Sampler.UNBOUNDED) {
            metadata.put("max_nr_evaluations_per_generation", Long.toString(maxNrEvaluationsPerGeneration));
        }
        if (seed != null) {
            metadata.put("seed", seed.toString());
        }
        return metadata;
    }

    private static Gson gson() {
        return AbcGsonConfig.gson();
    }

    private static AbcSmcOptions fromFile(OptionsFile file) {
        if (file == null) {
            throw new IllegalArgumentException("Options JSON is empty");
        }
        if (file.nrParticles == null) {
            throw new IllegalArgumentException("nr_particles is required");
        }
        Builder builder = builder(file.nrParticles);
        if (file.maxNrAllowedSampleAttemptsPerParticle != null) {
            builder.maxNrAllowedSampleAttemptsPerParticle(file.maxNrAllowedSampleAttemptsPerParticle);
        }
        if (file.minNrParticlesPerPopulation != null) {
            builder.minNrParticlesPerPopulation(file.minNrParticlesPerPopulation);
        }
        if (file.stopIfOnlySingleModelAlive != null) {
            builder.stopIfOnlySingleModelAlive(file.stopIfOnlySingleModelAlive);
        }
        if (file.maxNrEvaluationsPerGeneration != null) {
            builder.maxNrEvaluationsPerGeneration(file.maxNrEvaluationsPerGeneration);
        }
        if (file.showProgress != null) {
            builder.showProgress(file.showProgress);
        }
        if (file.failOnIncompleteGeneration != null) {
            builder.failOnIncompleteGeneration(file.failOnIncompleteGeneration);
        }
        return builder.seed(file.seed).build();
    }

    private OptionsFile toFile() {
        OptionsFile file = new OptionsFile();
        file.nrParticles = nrParticles;
        file.maxNrAllowedSampleAttemptsPerParticle = maxNrAllowedSampleAttemptsPerParticle;
        file.minNrParticlesPerPopulation = minNrParticlesPerPopulation;
        file.stopIfOnlySingleModelAlive = stopIfOnlySingleModelAlive;
        file.maxNrEvaluationsPerGeneration =
            maxNrEvaluationsPerGeneration == Sampler.UNBOUNDED ? null : maxNrEvaluationsPerGeneration;
        file.seed = seed;
        file.showProgress = showProgress;
        file.failOnIncompleteGeneration = failOnIncompleteGeneration;
        return file;
    }

    public int getNrParticles() {
        return nrParticles;
    }

    public int getMaxNrAllowedSampleAttemptsPerParticle() {
        return maxNrAllowedSampleAttemptsPerParticle;
    }

    public int getMinNrParticlesPerPopulation() {
        return minNrParticlesPerPopulation;
    }

    public boolean isStopIfOnlySingleModelAlive() {
        return stopIfOnlySingleModelAlive;
    }

    /**
     * @return the evaluation budget per generation, {@link Sampler#UNBOUNDED} if none
     */
    public long getMaxNrEvaluationsPerGeneration() {
        return maxNrEvaluationsPerGeneration;
    }

    /**
     * @return the seed, or null for a fresh seed per run
     */
    public Long getSeed() {
        return seed;
    }

    public boolean isShowProgress() {
        return showProgress;
    }

    public boolean isFailOnIncompleteGeneration() {
        return failOnIncompleteGeneration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AbcSmcOptions)) return false;
        AbcSmcOptions that = (AbcSmcOptions) o;
        return nrParticles == that.nrParticles
            && maxNrAllowedSampleAttemptsPerParticle == that.maxNrAllowedSampleAttemptsPerParticle
            && minNrParticlesPerPopulation == that.minNrParticlesPerPopulation
            && stopIfOnlySingleModelAlive == that.stopIfOnlySingleModelAlive
            && maxNrEvaluationsPerGeneration == that.maxNrEvaluationsPerGeneration
            && showProgress == that.showProgress
            && failOnIncompleteGeneration == that.failOnIncompleteGeneration
            && Objects.equals(seed, that.seed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nrParticles, maxNrAllowedSampleAttemptsPerParticle, minNrParticlesPerPopulation,
            stopIfOnlySingleModelAlive, maxNrEvaluationsPerGeneration, seed, showProgress, failOnIncompleteGeneration);
    }

    @Override
    public String toString() {
        return "AbcSmcOptions" + toMetadata();
    }

    public static final class Builder {
        private final int nrParticles;
        private int maxNrAllowedSampleAttemptsPerParticle = DEFAULT_MAX_ATTEMPTS_PER_PARTICLE;
        private int minNrParticlesPerPopulation = DEFAULT_MIN_NR_PARTICLES;
        private boolean stopIfOnlySingleModelAlive = true;
        private long maxNrEvaluationsPerGeneration = Sampler.UNBOUNDED;
        private Long seed;
        private boolean showProgress;
        private boolean failOnIncompleteGeneration;

        private Builder(int nrParticles) {
            this.nrParticles = nrParticles;
        }

        public Builder maxNrAllowedSampleAttemptsPerParticle(int cap) {
            this.maxNrAllowedSampleAttemptsPerParticle = cap;
            return this;
        }

        public Builder minNrParticlesPerPopulation(int min) {
            this.minNrParticlesPerPopulation = min;
            return this;
        }

        public Builder stopIfOnlySingleModelAlive(boolean stop) {
            this.stopIfOnlySingleModelAlive = stop;
            return this;
        }

        public Builder maxNrEvaluationsPerGeneration(long maxEval) {
            this.maxNrEvaluationsPerGeneration = maxEval;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder showProgress(boolean showProgress) {
            this.showProgress = showProgress;
            return this;
        }

        public Builder failOnIncompleteGeneration(boolean fail) {
            this.failOnIncompleteGeneration = fail;
            return this;
        }

        public AbcSmcOptions build() {
            return new AbcSmcOptions(this);
        }
    }

    /** JSON shape of the options; boxed so absent fields stay null. */
    private static final class OptionsFile {
        @SerializedName("nr_particles")
        private Integer nrParticles;

        @SerializedName("max_nr_allowed_sample_attempts_per_particle")
        private Integer maxNrAllowedSampleAttemptsPerParticle;

        @SerializedName("min_nr_particles_per_population")
        private Integer minNrParticlesPerPopulation;

        @SerializedName("stop_if_only_single_model_alive")
        private Boolean stopIfOnlySingleModelAlive;

        @SerializedName("max_nr_evaluations_per_generation")
        private Long maxNrEvaluationsPerGeneration;

        @SerializedName("seed")
        private Long seed;

        @SerializedName("show_progress")
        private Boolean showProgress;

        @SerializedName("fail_on_incomplete_generation")
        private Boolean failOnIncompleteGeneration;
    }
}
