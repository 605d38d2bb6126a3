package io.abcsmc.model.json;

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
import com.google.gson.GsonBuilder;
import io.abcsmc.model.scalar.ScalarModelTypeAdapterFactory;

/// Centralized Gson configuration for run options, priors and provenance JSON.
///
/// ## Usage
///
/// ```java
/// Gson gson = AbcGsonConfig.gson();
/// String json = gson.toJson(new NormalScalarModel(0.0, 1.0), ScalarModel.class);
/// // {"type":"normal","mean":0.0,"std_dev":1.0}
/// ScalarModel restored = gson.fromJson(json, ScalarModel.class);
/// ```
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled ([#gson()] only) | Human-readable option files |
/// | Serialize nulls | Disabled | Unset optional fields are omitted |
/// | HTML escaping | Disabled | Cleaner output |
/// | Special floats | Enabled | Infinite epsilons and bounds |
/// | ScalarModel adapter | Registered | Polymorphic priors |
///
/// [Gson] instances are thread-safe; the pretty instance is shared.
public final class AbcGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private AbcGsonConfig() {
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Compact form, one JSON document per line, used for provenance strings
    /// such as `DistanceFunction.toJson()`.
    ///
    /// @return a compact Gson instance
    public static Gson compactGson() {
        return builder().create();
    }

    /// @return a new GsonBuilder with the shared adapters and settings, not pretty printed
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(ScalarModelTypeAdapterFactory.create());
    }
}
