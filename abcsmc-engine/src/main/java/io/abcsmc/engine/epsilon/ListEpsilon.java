package io.abcsmc.engine.epsilon;

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

import com.google.gson.JsonObject;
import io.abcsmc.engine.storage.PopulationStore;
import io.abcsmc.model.json.AbcGsonConfig;

import java.util.List;

/**
 * Thresholds given up front, one per generation.
 */
public final class ListEpsilon implements Epsilon {

    private final List<Double> values;

    public ListEpsilon(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Need at least one epsilon value");
        }
        this.values = List.copyOf(values);
    }

    public static ListEpsilon of(double... values) {
        Double[] boxed = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return new ListEpsilon(List.of(boxed));
    }

    /**
     * @throws IllegalArgumentException if there is no value for generation {@code t}
     */
    @Override
    public double value(int t, PopulationStore history) {
        if (t < 0 || t >= values.size()) {
            throw new IllegalArgumentException("No epsilon for generation " + t + ", schedule has "
                + values.size() + " values");
        }
        return values.get(t);
    }

    @Override
    public String toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("name", getClass().getSimpleName());
        json.add("values", AbcGsonConfig.compactGson().toJsonTree(values));
        return AbcGsonConfig.compactGson().toJson(json);
    }
}
