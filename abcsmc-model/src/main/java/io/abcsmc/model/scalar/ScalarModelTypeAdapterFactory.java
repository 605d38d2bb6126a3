package io.abcsmc.model.scalar;

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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes any {@link ScalarModel} as a JSON object tagged with its
 * {@link ModelType} name.
 *
 * <pre>{@code
 *   new NormalScalarModel(0, 1)  ◄──►  { "type": "normal", "mean": 0.0, "std_dev": 1.0 }
 * }</pre>
 *
 * <p>The {@code "type"} member is always written first. The remaining members
 * come from Gson's reflective adapter for the concrete class. Priors are
 * stored with every run, so {@link io.abcsmc.model.json.AbcGsonConfig} installs
 * this factory on every Gson it builds.
 */
public final class ScalarModelTypeAdapterFactory implements TypeAdapterFactory {

    static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends ScalarModel>> modelsByType;

    private ScalarModelTypeAdapterFactory(Map<String, Class<? extends ScalarModel>> modelsByType) {
        this.modelsByType = Map.copyOf(modelsByType);
    }

    /**
     * @return a factory knowing the normal, uniform and lognormal priors
     */
    public static ScalarModelTypeAdapterFactory create() {
        Map<String, Class<? extends ScalarModel>> models = new LinkedHashMap<>();
        for (Class<? extends ScalarModel> model : List.<Class<? extends ScalarModel>>of(
            NormalScalarModel.class, UniformScalarModel.class, LogNormalScalarModel.class)) {
            String name = typeNameOf(model);
            if (models.put(name, model) != null) {
                throw new IllegalStateException("Duplicate model type '" + name + "'");
            }
        }
        return new ScalarModelTypeAdapterFactory(models);
    }

    private static String typeNameOf(Class<? extends ScalarModel> model) {
        ModelType annotation = model.getAnnotation(ModelType.class);
        if (annotation == null) {
            throw new IllegalStateException(model.getName() + " is missing @ModelType");
        }
        return annotation.value();
    }

    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!ScalarModel.class.isAssignableFrom(type.getRawType())) {
            return null;
        }
        return new TaggedAdapter<>(gson, type.getRawType());
    }

    private final class TaggedAdapter<T> extends TypeAdapter<T> {
        private final Gson gson;
        private final Class<? super T> requested;
        private final TypeAdapter<JsonElement> trees;

        TaggedAdapter(Gson gson, Class<? super T> requested) {
            this.gson = gson;
            this.requested = requested;
            this.trees = gson.getAdapter(JsonElement.class);
        }

        @Override
        public void write(JsonWriter out, T value) throws IOException {
            if (value == null) {
                out.nullValue();
                return;
            }
            ScalarModel model = (ScalarModel) value;
            JsonObject tagged = new JsonObject();
            tagged.addProperty(TYPE_FIELD, model.getModelType());
            delegateFor(model.getClass()).toJsonTree(model).getAsJsonObject().entrySet().stream()
                .filter(member -> !TYPE_FIELD.equals(member.getKey()))
                .forEach(member -> tagged.add(member.getKey(), member.getValue()));
            trees.write(out, tagged);
        }

        @Override
        @SuppressWarnings("unchecked")
        public T read(JsonReader in) throws IOException {
            JsonElement tree = trees.read(in);
            if (tree == null || tree.isJsonNull()) {
                return null;
            }
            JsonObject object = tree.getAsJsonObject();
            JsonElement tag = object.get(TYPE_FIELD);
            if (tag == null) {
                throw new IllegalArgumentException("Scalar model JSON has no '" + TYPE_FIELD + "': " + object);
            }
            Class<? extends ScalarModel> model = modelsByType.get(tag.getAsString());
            if (model == null) {
                throw new IllegalArgumentException("Unknown model type '" + tag.getAsString()
                    + "', expected one of " + modelsByType.keySet());
            }
            if (!requested.isAssignableFrom(model)) {
                throw new IllegalArgumentException("Model type '" + tag.getAsString() + "' is not a "
                    + requested.getSimpleName());
            }
            return (T) delegateFor(model).fromJsonTree(object);
        }

        @SuppressWarnings("unchecked")
        private TypeAdapter<ScalarModel> delegateFor(Class<? extends ScalarModel> model) {
            return (TypeAdapter<ScalarModel>) gson.getDelegateAdapter(
                ScalarModelTypeAdapterFactory.this, TypeToken.get(model));
        }
    }
}
