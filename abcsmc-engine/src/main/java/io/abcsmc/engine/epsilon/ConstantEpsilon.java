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

/**
 * The same threshold for every generation.
 */
public final class ConstantEpsilon implements Epsilon {

    private final double epsilon;

    public ConstantEpsilon(double epsilon) {
        if (Double.isNaN(epsilon)) {
            throw new IllegalArgumentException("Epsilon must not be NaN");
        }
        this.epsilon = epsilon;
    }

    @Override
    public double value(int t, PopulationStore history) {
        return epsilon;
    }

    @Override
    public String toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("name", getClass().getSimpleName());
        json.addProperty("epsilon", epsilon);
        return AbcGsonConfig.compactGson().toJson(json);
    }
}
