package io.abcsmc.random;

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

import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.abcsmc.model.Parameter;
import io.abcsmc.model.json.AbcGsonConfig;
import io.abcsmc.model.scalar.ScalarModel;
import org.apache.commons.rng.UniformRandomProvider;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Prior over the parameters of one model: independent named scalar priors.
 *
 * <p>The density of a parameter is the product of the scalar densities. A
 * parameter that lacks a name of this prior, or carries an extra one, has
 * density 0.
 *
 * <pre>{@code
 * ParameterPrior prior = ParameterPrior.builder()
 *     .add("rate", new UniformScalarModel(0.0, 10.0))
 *     .add("shift", NormalScalarModel.standardNormal())
 *     .build();
 * Parameter theta = prior.rvs(rng);
 * double density = prior.pdf(theta);
 * }</pre>
 */
public final class ParameterPrior {

    private static final Type MODELS_TYPE = new TypeToken<LinkedHashMap<String, ScalarModel>>() {}.getType();

    private final Map<String, ScalarModel> models;
    private final List<String> names;
    private final List<ScalarSampler> samplers;

    private ParameterPrior(LinkedHashMap<String, ScalarModel> models) {
        this.models = Collections.unmodifiableMap(models);
        this.names = List.copyOf(models.keySet());
        List<ScalarSampler> bound = new ArrayList<>(models.size());
        for (ScalarModel model : models.values()) {
            bound.add(ScalarSamplerFactory.forModel(model));
        }
        this.samplers = List.copyOf(bound);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param json a JSON object mapping parameter names to typed scalar models
     * @return the prior
     * @throws IllegalArgumentException if the JSON is malformed or a type is unknown
     */
    public static ParameterPrior fromJson(String json) {
        try {
            LinkedHashMap<String, ScalarModel> models = AbcGsonConfig.gson().fromJson(json, MODELS_TYPE);
            if (models == null) {
                throw new IllegalArgumentException("Empty prior JSON");
            }
            Builder builder = builder();
            models.forEach(builder::add);
            return builder.build();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed prior JSON: " + e.getMessage(), e);
        }
    }

    /**
     * @param rng random source
     * @return one draw, with names in declaration order
     */
    public Parameter rvs(UniformRandomProvider rng) {
        Parameter.Builder builder = Parameter.builder();
        for (int i = 0; i < names.size(); i++) {
            builder.put(names.get(i), samplers.get(i).sample(rng));
        }
        return builder.build();
    }

    /**
     * @param parameter the parameter to evaluate
     * @return product of the scalar densities, 0 if the names do not match
     */
    public double pdf(Parameter parameter) {
        if (parameter.size() != names.size()) {
            return 0.0;
        }
        double density = 1.0;
        for (Map.Entry<String, ScalarModel> entry : models.entrySet()) {
            if (!parameter.has(entry.getKey())) {
                return 0.0;
            }
            density *= entry.getValue().pdf(parameter.get(entry.getKey()));
            if (density == 0.0) {
                return 0.0;
            }
        }
        return density;
    }

    public List<String> names() {
        return names;
    }

    public Map<String, ScalarModel> getModels() {
        return models;
    }

    public int size() {
        return names.size();
    }

    public String toJson() {
        return AbcGsonConfig.compactGson().toJson(new LinkedHashMap<>(models), MODELS_TYPE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterPrior)) return false;
        return models.equals(((ParameterPrior) o).models) && names.equals(((ParameterPrior) o).names);
    }

    @Override
    public int hashCode() {
        return Objects.hash(models);
    }

    @Override
    public String toString() {
        return "ParameterPrior" + models;
    }

    public static final class Builder {
        private final LinkedHashMap<String, ScalarModel> models = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String name, ScalarModel model) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(model, "model");
            if (models.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate parameter name: " + name);
            }
            models.put(name, model);
            return this;
        }

        public ParameterPrior build() {
            return new ParameterPrior(new LinkedHashMap<>(models));
        }
    }
}
